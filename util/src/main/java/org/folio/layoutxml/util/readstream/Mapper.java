package org.folio.layoutxml.util.readstream;

/**
 * Represents a FIFO queue for mapping elements from one type to another.
 * Implementations of this class are to be used with the MappingReadStream
 */
public interface Mapper<T, V> {

  /**
   * Store the element for next mapping.
   * This is a blocking operation so the implementation should ensure that it returns quickly.
   * @param item element to be mapped
   */
  void push(T item);

  /**
   * Retrieve the next mapped element. If the element is not ready, 'null' is returned.
   * @param ended true if push is not called again; the mapper must then flush
   * @return mapped element
   */
  V poll(boolean ended);

  /**
   * Release resources; called when the stream fails. Must be idempotent.
   */
  default void close() {
  }

}
