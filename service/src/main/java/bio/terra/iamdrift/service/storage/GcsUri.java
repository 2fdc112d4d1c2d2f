package bio.terra.iamdrift.service.storage;

import bio.terra.iamdrift.common.exception.ObjectStorageException;
import org.apache.commons.lang3.StringUtils;

/**
 * A parsed gs://bucket/object URI.
 *
 * @param bucket the bucket name
 * @param name the object name, which may contain slashes
 */
public record GcsUri(String bucket, String name) {
  private static final String SCHEME = "gs://";

  public static GcsUri parse(String uri) {
    if (!StringUtils.startsWith(uri, SCHEME)) {
      throw new ObjectStorageException("failed to parse GCS URI, missing gs:// prefix: " + uri);
    }
    String path = uri.substring(SCHEME.length());
    int slash = path.indexOf('/');
    if (slash <= 0 || slash == path.length() - 1) {
      throw new ObjectStorageException(
          "failed to parse GCS URI, expected gs://<bucket>/<object>: " + uri);
    }
    return new GcsUri(path.substring(0, slash), path.substring(slash + 1));
  }

  @Override
  public String toString() {
    return SCHEME + bucket + "/" + name;
  }
}
