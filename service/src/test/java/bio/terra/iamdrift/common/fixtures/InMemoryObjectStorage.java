package bio.terra.iamdrift.common.fixtures;

import bio.terra.iamdrift.common.exception.ObjectStorageException;
import bio.terra.iamdrift.service.storage.GcsUri;
import bio.terra.iamdrift.service.storage.ObjectStorage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Object storage holding test resources under gs:// URIs. */
public class InMemoryObjectStorage implements ObjectStorage {
  private final Map<String, byte[]> objects = new LinkedHashMap<>();
  private final Set<String> unreadable = new HashSet<>();

  public InMemoryObjectStorage put(String gcsUri, byte[] contents) {
    objects.put(gcsUri, contents);
    return this;
  }

  /** Store an object that opens but fails on the first read, like a lazily fetched GCS object. */
  public InMemoryObjectStorage putUnreadable(String gcsUri) {
    unreadable.add(gcsUri);
    return put(gcsUri, new byte[0]);
  }

  /** Store a classpath resource under the given URI. */
  public InMemoryObjectStorage putResource(String gcsUri, String resource) {
    try (InputStream in = getClass().getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalArgumentException("No test resource " + resource);
      }
      return put(gcsUri, in.readAllBytes());
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Override
  public List<String> objectsWithName(String bucket, String name) {
    List<String> uris = new ArrayList<>();
    for (String uri : objects.keySet()) {
      GcsUri parsed = GcsUri.parse(uri);
      if (parsed.bucket().equals(bucket)
          && (parsed.name().equals(name) || parsed.name().endsWith("/" + name))) {
        uris.add(uri);
      }
    }
    return uris;
  }

  @Override
  public InputStream downloadObject(String bucket, String name) {
    GcsUri uri = new GcsUri(bucket, name);
    byte[] contents = objects.get(uri.toString());
    if (contents == null) {
      throw new ObjectStorageException("No such object " + uri);
    }
    if (unreadable.contains(uri.toString())) {
      return new InputStream() {
        @Override
        public int read() {
          throw new ObjectStorageException("failed to download object " + uri);
        }
      };
    }
    return new ByteArrayInputStream(contents);
  }
}
