package ca.gc.cra.tether.domain.op;

import ca.gc.cra.tether.validation.Strings;

/**
 * Transport-level subscription to a topic filter.
 *
 * @since 0.1.0
 */
public final class SubscribeOperation extends PipelineOperation {
  private final String topicFilter;

  /**
   * Creates the operation.
   *
   * @param topicFilter filter, wildcards allowed
   * @param callback completion callback; may be {@code null}
   */
  public SubscribeOperation(String topicFilter, OperationCallback callback) {
    super(callback);
    this.topicFilter = Strings.requireTopicFilter("topicFilter", topicFilter);
  }

  @Override
  public OperationKind kind() {
    return OperationKind.SUBSCRIBE;
  }

  public String topicFilter() {
    return topicFilter;
  }
}
