package bio.terra.iamdrift.app.configuration.spring;

import bio.terra.iamdrift.app.configuration.external.GcsConfiguration;
import bio.terra.iamdrift.common.exception.AssetInventoryException;
import com.google.api.gax.retrying.RetrySettings;
import com.google.cloud.asset.v1.AssetServiceClient;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageOptions;
import java.io.IOException;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

/**
 * Google Cloud clients, authenticated with application default credentials. Lazy, so that only
 * the commands that talk to Google Cloud need credentials.
 */
@Configuration
public class GoogleCloudConfiguration {

  @Lazy
  @Bean
  public AssetServiceClient assetServiceClient() {
    try {
      return AssetServiceClient.create();
    } catch (IOException e) {
      throw new AssetInventoryException("failed to initialize asset API client", e);
    }
  }

  @Lazy
  @Bean
  public Storage storage(GcsConfiguration gcsConfiguration) {
    GcsConfiguration.Retry retry = gcsConfiguration.getRetry();
    RetrySettings retrySettings =
        StorageOptions.getDefaultRetrySettings().toBuilder()
            .setInitialRetryDelay(toThreeten(retry.getInitialDelay()))
            .setMaxRetryDelay(toThreeten(retry.getMaxDelay()))
            .setRetryDelayMultiplier(retry.getDelayMultiplier())
            .setTotalTimeout(toThreeten(retry.getTotalTimeout()))
            .build();
    return StorageOptions.newBuilder().setRetrySettings(retrySettings).build().getService();
  }

  private static org.threeten.bp.Duration toThreeten(java.time.Duration duration) {
    return org.threeten.bp.Duration.ofMillis(duration.toMillis());
  }
}
