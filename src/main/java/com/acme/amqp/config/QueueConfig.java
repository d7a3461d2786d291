package com.acme.amqp.config;

import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.context.annotation.EachProperty;
import io.micronaut.context.annotation.Parameter;

import java.util.HashMap;
import java.util.Map;

/**
 * Configuration of one logical queue: the queue itself, the exchange it is bound to,
 * how it is consumed and published to, and the broker endpoint it lives on.
 * One instance is bound per entry under {@code amqp.services}.
 */
@EachProperty("amqp.services")
public class QueueConfig {

    private String queueName;
    private Queue queue = new Queue();
    private Exchange exchange = new Exchange();
    private Consume consume = new Consume();
    private Publish publish = new Publish();
    private Endpoint endpoint = new Endpoint();

    public QueueConfig(@Parameter String name) {
        this.queueName = name;
    }

    public String getQueueName() {
        return queueName;
    }

    public void setQueueName(String queueName) {
        this.queueName = queueName;
    }

    public Queue getQueue() {
        return queue;
    }

    public void setQueue(Queue queue) {
        this.queue = queue;
    }

    public Exchange getExchange() {
        return exchange;
    }

    public void setExchange(Exchange exchange) {
        this.exchange = exchange;
    }

    public Consume getConsume() {
        return consume;
    }

    public void setConsume(Consume consume) {
        this.consume = consume;
    }

    public Publish getPublish() {
        return publish;
    }

    public void setPublish(Publish publish) {
        this.publish = publish;
    }

    public Endpoint getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(Endpoint endpoint) {
        this.endpoint = endpoint;
    }

    @ConfigurationProperties("queue")
    public static class Queue {
        private boolean durable = true;
        private boolean autoDelete = false;
        private boolean exclusive = false;
        private boolean noWait = false;
        private Map<String, String> args = new HashMap<>();

        public boolean isDurable() {
            return durable;
        }

        public void setDurable(boolean durable) {
            this.durable = durable;
        }

        public boolean isAutoDelete() {
            return autoDelete;
        }

        public void setAutoDelete(boolean autoDelete) {
            this.autoDelete = autoDelete;
        }

        public boolean isExclusive() {
            return exclusive;
        }

        public void setExclusive(boolean exclusive) {
            this.exclusive = exclusive;
        }

        public boolean isNoWait() {
            return noWait;
        }

        public void setNoWait(boolean noWait) {
            this.noWait = noWait;
        }

        public Map<String, String> getArgs() {
            return args;
        }

        public void setArgs(Map<String, String> args) {
            this.args = args;
        }
    }

    /**
     * The exchange a queue is bound to. An empty name is the broker's default exchange,
     * which routes on queue name without an explicit binding.
     */
    @ConfigurationProperties("exchange")
    public static class Exchange {
        private String name = "";
        private String kind = "topic";
        private boolean durable = true;
        private boolean autoDelete = false;
        private boolean internal = false;
        private boolean noWait = false;
        private Map<String, String> args = new HashMap<>();

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public boolean isDefault() {
            return name == null || name.isEmpty();
        }

        public String getKind() {
            return kind;
        }

        public void setKind(String kind) {
            this.kind = kind;
        }

        public boolean isDurable() {
            return durable;
        }

        public void setDurable(boolean durable) {
            this.durable = durable;
        }

        public boolean isAutoDelete() {
            return autoDelete;
        }

        public void setAutoDelete(boolean autoDelete) {
            this.autoDelete = autoDelete;
        }

        public boolean isInternal() {
            return internal;
        }

        public void setInternal(boolean internal) {
            this.internal = internal;
        }

        public boolean isNoWait() {
            return noWait;
        }

        public void setNoWait(boolean noWait) {
            this.noWait = noWait;
        }

        public Map<String, String> getArgs() {
            return args;
        }

        public void setArgs(Map<String, String> args) {
            this.args = args;
        }
    }

    @ConfigurationProperties("consume")
    public static class Consume {
        private String consumer = "";
        private boolean autoAck = false;
        private boolean exclusive = false;
        private boolean noLocal = false;
        private boolean noWait = false;
        private Map<String, String> args = new HashMap<>();

        public String getConsumer() {
            return consumer;
        }

        public void setConsumer(String consumer) {
            this.consumer = consumer;
        }

        public boolean isAutoAck() {
            return autoAck;
        }

        public void setAutoAck(boolean autoAck) {
            this.autoAck = autoAck;
        }

        public boolean isExclusive() {
            return exclusive;
        }

        public void setExclusive(boolean exclusive) {
            this.exclusive = exclusive;
        }

        public boolean isNoLocal() {
            return noLocal;
        }

        public void setNoLocal(boolean noLocal) {
            this.noLocal = noLocal;
        }

        public boolean isNoWait() {
            return noWait;
        }

        public void setNoWait(boolean noWait) {
            this.noWait = noWait;
        }

        public Map<String, String> getArgs() {
            return args;
        }

        public void setArgs(Map<String, String> args) {
            this.args = args;
        }
    }

    @ConfigurationProperties("publish")
    public static class Publish {
        private boolean mandatory = false;
        private boolean immediate = false;

        public boolean isMandatory() {
            return mandatory;
        }

        public void setMandatory(boolean mandatory) {
            this.mandatory = mandatory;
        }

        public boolean isImmediate() {
            return immediate;
        }

        public void setImmediate(boolean immediate) {
            this.immediate = immediate;
        }
    }

    /**
     * Where the broker lives. {@code amqps} as protocol enables TLS.
     */
    @ConfigurationProperties("endpoint")
    public static class Endpoint {
        private String protocol = "amqp";
        private String user = "guest";
        private String password = "guest";
        private String host = "localhost";
        private int port = 5672;
        private String vhost = "/";

        public String getProtocol() {
            return protocol;
        }

        public void setProtocol(String protocol) {
            this.protocol = protocol;
        }

        public String getUser() {
            return user;
        }

        public void setUser(String user) {
            this.user = user;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public String getVhost() {
            return vhost;
        }

        public void setVhost(String vhost) {
            this.vhost = vhost;
        }

        public boolean isTls() {
            return "amqps".equalsIgnoreCase(protocol);
        }
    }
}
