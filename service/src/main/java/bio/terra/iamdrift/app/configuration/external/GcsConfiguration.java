package bio.terra.iamdrift.app.configuration.external;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties
@ConfigurationProperties(prefix = "iamdrift.gcs")
public class GcsConfiguration {
  /** Largest Terraform state file read, in bytes. Longer files are truncated. */
  private long stateFileSizeLimitBytes = 512L * 1024 * 1024;

  private final Retry retry = new Retry();

  public long getStateFileSizeLimitBytes() {
    return stateFileSizeLimitBytes;
  }

  public void setStateFileSizeLimitBytes(long stateFileSizeLimitBytes) {
    this.stateFileSizeLimitBytes = stateFileSizeLimitBytes;
  }

  public Retry getRetry() {
    return retry;
  }

  /** Retry settings of the storage client */
  public static class Retry {
    private Duration initialDelay = Duration.ofSeconds(1);
    private Duration maxDelay = Duration.ofSeconds(20);
    private double delayMultiplier = 2.0;
    private Duration totalTimeout = Duration.ofSeconds(60);

    public Duration getInitialDelay() {
      return initialDelay;
    }

    public void setInitialDelay(Duration initialDelay) {
      this.initialDelay = initialDelay;
    }

    public Duration getMaxDelay() {
      return maxDelay;
    }

    public void setMaxDelay(Duration maxDelay) {
      this.maxDelay = maxDelay;
    }

    public double getDelayMultiplier() {
      return delayMultiplier;
    }

    public void setDelayMultiplier(double delayMultiplier) {
      this.delayMultiplier = delayMultiplier;
    }

    public Duration getTotalTimeout() {
      return totalTimeout;
    }

    public void setTotalTimeout(Duration totalTimeout) {
      this.totalTimeout = totalTimeout;
    }
  }
}
