package ca.gc.cra.tether.domain.op;

import ca.gc.cra.tether.validation.Strings;
import java.util.Objects;

/**
 * Uploads a named blob through the device connection.
 *
 * @since 0.1.0
 */
public final class UploadBlobOperation extends PipelineOperation {
  private final String blobName;
  private final byte[] content;

  /**
   * Creates the operation.
   *
   * @param blobName blob name; printable ASCII without {@code /} wildcards
   * @param content blob bytes; copied
   * @param callback completion callback; may be {@code null}
   */
  public UploadBlobOperation(String blobName, byte[] content, OperationCallback callback) {
    super(callback);
    this.blobName = Strings.requirePrintableAscii("blobName", blobName, 1024);
    if (this.blobName.indexOf('+') >= 0 || this.blobName.indexOf('#') >= 0) {
      throw new IllegalArgumentException("blobName must not contain wildcard characters");
    }
    this.content = Objects.requireNonNull(content, "content").clone();
  }

  @Override
  public OperationKind kind() {
    return OperationKind.UPLOAD_BLOB;
  }

  public String blobName() {
    return blobName;
  }

  public byte[] content() {
    return content.clone();
  }

  @Override
  public PipelineOperation copyForRetry(OperationCallback replacementCallback) {
    return new UploadBlobOperation(blobName, content, replacementCallback);
  }
}
