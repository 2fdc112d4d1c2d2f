package bio.terra.iamdrift.service.storage;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import bio.terra.iamdrift.common.BaseUnitTest;
import bio.terra.iamdrift.common.exception.ObjectStorageException;
import com.google.cloud.ReadChannel;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

public class GoogleCloudObjectStorageTest extends BaseUnitTest {

  @Test
  @SuppressWarnings("unchecked")
  void downloadObject_missingObject_failsOnReadWithUri() throws Exception {
    StorageException notFound = new StorageException(404, "No such object");
    ReadChannel reader = mock(ReadChannel.class);
    when(reader.isOpen()).thenReturn(true);
    when(reader.read(any(ByteBuffer.class))).thenThrow(notFound);
    Storage storage = mock(Storage.class);
    when(storage.reader(BlobId.of("my-bucket", "envs/prod/default.tfstate"))).thenReturn(reader);
    ObjectProvider<Storage> provider = mock(ObjectProvider.class);
    when(provider.getObject()).thenReturn(storage);

    // the object is only fetched on read
    GoogleCloudObjectStorage objectStorage = new GoogleCloudObjectStorage(provider);
    InputStream in = objectStorage.downloadObject("my-bucket", "envs/prod/default.tfstate");
    ObjectStorageException e = assertThrows(ObjectStorageException.class, () -> in.read());

    assertThat(
        e.getMessage(),
        equalTo("failed to download object gs://my-bucket/envs/prod/default.tfstate"));
    assertThat(e.getCause(), sameInstance(notFound));
  }
}
