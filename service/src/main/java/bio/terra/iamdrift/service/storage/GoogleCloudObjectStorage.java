package bio.terra.iamdrift.service.storage;

import bio.terra.iamdrift.common.exception.ObjectStorageException;
import com.google.cloud.ReadChannel;
import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.Channels;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class GoogleCloudObjectStorage implements ObjectStorage {
  private static final Logger logger = LoggerFactory.getLogger(GoogleCloudObjectStorage.class);

  private final ObjectProvider<Storage> storage;

  @Autowired
  public GoogleCloudObjectStorage(ObjectProvider<Storage> storage) {
    this.storage = storage;
  }

  @Override
  public List<String> objectsWithName(String bucket, String name) {
    List<String> uris = new ArrayList<>();
    try {
      for (Blob blob : storage.getObject().list(bucket).iterateAll()) {
        String objectName = blob.getName();
        if (StringUtils.equals(objectName, name) || StringUtils.endsWith(objectName, "/" + name)) {
          uris.add(new GcsUri(bucket, objectName).toString());
        }
      }
    } catch (StorageException e) {
      throw new ObjectStorageException(
          String.format("failed to list objects named %s in bucket %s", name, bucket), e);
    }
    logger.debug("Found {} objects named {} in bucket {}", uris.size(), name, bucket);
    return uris;
  }

  /**
   * Open a stream over the object. The object is fetched lazily, so a missing or unreadable object
   * surfaces as an {@link ObjectStorageException} from the first read rather than from this call.
   */
  @Override
  public InputStream downloadObject(String bucket, String name) {
    GcsUri uri = new GcsUri(bucket, name);
    try {
      ReadChannel reader = storage.getObject().reader(BlobId.of(bucket, name));
      return new DownloadStream(Channels.newInputStream(reader), uri);
    } catch (StorageException e) {
      throw downloadFailure(uri, e);
    }
  }

  private static ObjectStorageException downloadFailure(GcsUri uri, StorageException e) {
    return new ObjectStorageException(String.format("failed to download object %s", uri), e);
  }

  /** Rethrows storage failures raised while reading with the object's URI attached. */
  private static class DownloadStream extends FilterInputStream {
    private final GcsUri uri;

    DownloadStream(InputStream in, GcsUri uri) {
      super(in);
      this.uri = uri;
    }

    @Override
    public int read() throws IOException {
      try {
        return super.read();
      } catch (StorageException e) {
        throw downloadFailure(uri, e);
      }
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
      try {
        return super.read(b, off, len);
      } catch (StorageException e) {
        throw downloadFailure(uri, e);
      }
    }
  }
}
