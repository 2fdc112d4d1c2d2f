package bio.terra.iamdrift.app.configuration.external;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@EnableConfigurationProperties
@Validated
@ConfigurationProperties(prefix = "iamdrift.detection")
public class DriftDetectionConfiguration {
  /** Google Cloud organization id to detect drift in, e.g. 123435456456 */
  @NotBlank private String organizationId;

  /** Asset query selecting the buckets that hold Terraform state, e.g. labels.terraform:* */
  private String gcsBucketQuery;

  /** Path of the driftignore file. A missing file means nothing is ignored. */
  private String driftignoreFile = ".driftignore";

  /** Maximum number of concurrent requests to Google Cloud */
  @Min(1)
  private int maxConcurrentRequests = 10;

  public String getOrganizationId() {
    return organizationId;
  }

  public void setOrganizationId(String organizationId) {
    this.organizationId = organizationId;
  }

  public String getGcsBucketQuery() {
    return gcsBucketQuery;
  }

  public void setGcsBucketQuery(String gcsBucketQuery) {
    this.gcsBucketQuery = gcsBucketQuery;
  }

  public String getDriftignoreFile() {
    return driftignoreFile;
  }

  public void setDriftignoreFile(String driftignoreFile) {
    this.driftignoreFile = driftignoreFile;
  }

  public int getMaxConcurrentRequests() {
    return maxConcurrentRequests;
  }

  public void setMaxConcurrentRequests(int maxConcurrentRequests) {
    this.maxConcurrentRequests = maxConcurrentRequests;
  }
}
