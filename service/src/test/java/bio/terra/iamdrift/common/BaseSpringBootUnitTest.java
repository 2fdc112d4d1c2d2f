package bio.terra.iamdrift.common;

import bio.terra.iamdrift.app.Main;
import bio.terra.iamdrift.common.annotations.Unit;
import bio.terra.iamdrift.service.assetinventory.AssetInventory;
import bio.terra.iamdrift.service.storage.ObjectStorage;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

/**
 * Base class for Spring Boot unit tests. The Google Cloud backed beans are replaced by mocks so
 * the context starts without credentials.
 */
@Unit
@SpringBootTest(classes = Main.class)
public class BaseSpringBootUnitTest {
  @MockBean private AssetInventory mockAssetInventory;
  @MockBean private ObjectStorage mockObjectStorage;

  public AssetInventory mockAssetInventory() {
    return mockAssetInventory;
  }

  public ObjectStorage mockObjectStorage() {
    return mockObjectStorage;
  }
}
