package bio.terra.iamdrift.service.storage;

import java.io.InputStream;
import java.util.List;

/* Allow for object storage mocking. */
public interface ObjectStorage {

  /**
   * Find objects in a bucket whose final path segment equals {@code name}.
   *
   * @return gs:// URIs of the matching objects
   */
  List<String> objectsWithName(String bucket, String name);

  /** Open an object for reading. The caller closes the stream. */
  InputStream downloadObject(String bucket, String name);
}
