package net.jodah.redial;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.TimeoutException;

import net.jodah.redial.util.Pipe;

import com.rabbitmq.client.AMQP;

/**
 * A channel opened on an {@link AmqpConnection}. A channel does not survive a redial of its
 * connection; open a new one after the connection signals a successful redial.
 * 
 * @author Jonathan Halterman
 */
public interface AmqpChannel {
  /**
   * Acknowledges the delivery with the {@code deliveryTag}, or every unacknowledged delivery up to
   * and including it when {@code multiple} is true.
   */
  void ack(long deliveryTag, boolean multiple) throws IOException;

  /**
   * Rejects the delivery with the {@code deliveryTag}, or every unacknowledged delivery up to and
   * including it when {@code multiple} is true.
   */
  void nack(long deliveryTag, boolean multiple, boolean requeue) throws IOException;

  void reject(long deliveryTag, boolean requeue) throws IOException;

  void publish(String exchange, String routingKey, byte[] body, AMQP.BasicProperties properties)
      throws IOException;

  void exchangeDeclare(String exchange, String type, boolean durable, boolean autoDelete,
      Map<String, Object> arguments) throws IOException;

  /**
   * Declares the {@code queue}, returning its name. An empty {@code queue} name lets the broker
   * generate one.
   */
  String queueDeclare(String queue, boolean durable, boolean exclusive, boolean autoDelete,
      Map<String, Object> arguments) throws IOException;

  void queueBind(String queue, String exchange, String routingKey, Map<String, Object> arguments)
      throws IOException;

  void queueUnbind(String queue, String exchange, String routingKey, Map<String, Object> arguments)
      throws IOException;

  void qos(int prefetchCount, int prefetchSize, boolean global) throws IOException;

  /**
   * Starts a consumer on the {@code queue} whose deliveries are sent to {@code deliveries}. The
   * consumer thread blocks while {@code deliveries} is full. {@code deliveries} is closed when the
   * consumer is cancelled or the channel shuts down.
   * 
   * @return the consumer tag, generated by the broker when {@code consumerTag} is empty
   */
  String consume(String queue, String consumerTag, boolean autoAck, Pipe<Delivery> deliveries)
      throws IOException;

  void cancel(String consumerTag) throws IOException;

  int getChannelNumber();

  boolean isOpen();

  void close() throws IOException, TimeoutException;
}
