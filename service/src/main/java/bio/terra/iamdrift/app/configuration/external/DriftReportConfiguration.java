package bio.terra.iamdrift.app.configuration.external;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties
@ConfigurationProperties(prefix = "iamdrift.report")
public class DriftReportConfiguration {
  /** If set, the drift is also written to this file as JSON */
  private String outputFile;

  /** Text appended to the printed report when drift is found */
  private String messageAppend;

  public String getOutputFile() {
    return outputFile;
  }

  public void setOutputFile(String outputFile) {
    this.outputFile = outputFile;
  }

  public String getMessageAppend() {
    return messageAppend;
  }

  public void setMessageAppend(String messageAppend) {
    this.messageAppend = messageAppend;
  }
}
