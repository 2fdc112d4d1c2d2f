package bio.terra.iamdrift.service.drift;

import com.google.common.collect.ImmutableList;
import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Recognizes grants Google Cloud makes to its own service agents when an API is enabled. Terraform
 * configurations never declare these, so they are dropped from the drift report. A URI is a
 * default grant when any pattern is found anywhere in it.
 */
@Component
public class DefaultServiceAgentFilter {
  static final List<String> DEFAULT_GRANT_PATTERNS =
      ImmutableList.of(
          "aiplatform\\.serviceAgent/serviceAccount:service-(?:\\d*)@gcp-sa-aiplatform\\.iam\\.gserviceaccount\\.com",
          "apigateway\\.serviceAgent/serviceAccount:service-(?:\\d*)@gcp-sa-apigateway\\.iam\\.gserviceaccount\\.com",
          "apigateway_management\\.serviceAgent/serviceAccount:service-(?:\\d*)@gcp-sa-apigateway-mgmt\\.iam\\.gserviceaccount\\.com",
          "appengine\\.serviceAgent/serviceAccount:service-(?:\\d*)@gcp-gae-service\\.iam\\.gserviceaccount\\.com",
          "appengineflex\\.serviceAgent/serviceAccount:service-(?:\\d*)@gae-api-prod\\.iam\\.gserviceaccount\\.com",
          "appengineflex\\.serviceAgent/serviceAccount:service-(?:\\d*)@gae-api-prod\\.google\\.com\\.iam\\.gserviceaccount\\.com",
          "artifactregistry\\.serviceAgent/serviceAccount:service-(?:\\d*)@gcp-sa-artifactregistry\\.iam\\.gserviceaccount\\.com",
          "batch\\.serviceAgent/serviceAccount:service-(?:\\d*)@gcp-sa-cloudbatch\\.iam\\.gserviceaccount\\.com",
          "bigquerydatatransfer\\.serviceAgent/serviceAccount:service-(?:\\d*)@gcp-sa-bigquerydatatransfer\\.iam\\.gserviceaccount\\.com",
          "binaryauthorization\\.serviceAgent/serviceAccount:service-(?:\\d*)@gcp-sa-binaryauthorization\\.iam\\.gserviceaccount\\.com",
          "cloudasset\\.serviceAgent/serviceAccount:service-(?:\\d*)@gcp-sa-cloudasset\\.iam\\.gserviceaccount\\.com",
          "cloudbuild\\.builds\\.builder/serviceAccount:(?:\\d*)@cloudbuild\\.gserviceaccount\\.com",
          "cloudbuild\\.serviceAgent/serviceAccount:service-(?:\\d*)@gcp-sa-cloudbuild\\.iam\\.gserviceaccount\\.com",
          "cloudfunctions\\.serviceAgent/serviceAccount:service-(?:\\d*)@gcf-admin-robot\\.iam\\.gserviceaccount\\.com",
          "cloudfunctions\\.serviceAgent/serviceAccount:service-project-(?:\\d*)@security-center-api\\.iam\\.gserviceaccount\\.com",
          "cloudiot\\.serviceAgent/serviceAccount:service-(?:\\d*)@gcp-sa-cloudiot\\.iam\\.gserviceaccount\\.com",
          "cloudkms\\.serviceAgent/serviceAccount:service-(?:\\d*)@gcp-sa-cloudkms\\.iam\\.gserviceaccount\\.com",
          "cloudscheduler\\.serviceAgent/serviceAccount:(?:\\d*)-compute@developer\\.gserviceaccount\\.com",
          "cloudscheduler\\.serviceAgent/serviceAccount:service-(?:\\d*)@gcp-sa-cloudscheduler\\.iam\\.gserviceaccount\\.com",
          "cloudtpu\\.serviceAgent/serviceAccount:service-(?:\\d*)@gcp-sa-tpu\\.iam\\.gserviceaccount\\.com",
          "compute\\.networkViewer/serviceAccount:(?:\\d*)-compute@developer\\.gserviceaccount\\.com",
          "compute\\.serviceAgent/serviceAccount:service-(?:\\d*)@compute-system\\.iam\\.gserviceaccount\\.com",
          "connectors\\.serviceAgent/serviceAccount:service-(?:\\d*)@gcp-sa-connectors\\.iam\\.gserviceaccount\\.com",
          "container\\.serviceAgent/serviceAccount:service-(?:\\d*)@container-engine-robot\\.iam\\.gserviceaccount\\.com",
          "containeranalysis\\.ServiceAgent/serviceAccount:service-(?:\\d*)@container-analysis\\.iam\\.gserviceaccount\\.com",
          "containerregistry\\.ServiceAgent/serviceAccount:service-(?:\\d*)@containerregistry\\.iam\\.gserviceaccount\\.com",
          "containerscanning\\.ServiceAgent/serviceAccount:service-(?:\\d*)@gcp-sa-containerscanning\\.iam\\.gserviceaccount\\.com",
          "containerthreatdetection.serviceAgent/serviceAccount:service-(?:\\d*)@gcp-sa-ktd-control\\.iam\\.gserviceaccount\\.com",
          "dataflow\\.serviceAgent/serviceAccount:service-(?:\\d*)@dataflow-service-producer-prod\\.iam\\.gserviceaccount\\.com",
          "dataform\\.serviceAgent/serviceAccount:service-(?:\\d*)@gcp-sa-dataform\\.iam\\.gserviceaccount\\.com",
          "datafusion\\.serviceAgent/serviceAccount:service-(?:\\d*)@gcp-sa-datafusion\\.iam\\.gserviceaccount\\.com",
          "datapipelines\\.serviceAgent/serviceAccount:service-(?:\\d*)@gcp-sa-datapipelines\\.iam\\.gserviceaccount\\.com",
          "dataprep\\.serviceAgent/serviceAccount:service-(?:\\d*)@trifacta-gcloud-prod\\.iam\\.gserviceaccount\\.com",
          "dataproc\\.serviceAgent/serviceAccount:service-(?:\\d*)@dataproc-accounts\\.iam\\.gserviceaccount\\.com",
          "editor/serviceAccount:(?:\\d*)-compute@developer\\.gserviceaccount\\.com",
          "editor/serviceAccount:(?:\\d*)@cloudservices\\.gserviceaccount\\.com",
          "endpointsportal\\.serviceAgent/serviceAccount:service-(?:\\d*)@endpoints-portal\\.iam\\.gserviceaccount\\.com",
          "eventarc\\.serviceAgent/serviceAccount:service-(?:\\d*)@gcp-sa-eventarc\\.iam\\.gserviceaccount\\.com",
          "file\\.serviceAgent/serviceAccount:service-(?:\\d*)@cloud-filer\\.iam\\.gserviceaccount\\.com",
          "firebase\\.managementServiceAgent/serviceAccount:firebase-service-account@firebase-sa-management\\.iam\\.gserviceaccount\\.com",
          "firebase\\.managementServiceAgent/serviceAccount:service-(?:\\d*)@gcp-sa-firebase\\.iam\\.gserviceaccount\\.com",
          "firebaserules\\.system/serviceAccount:service-(?:\\d*)@firebase-rules\\.iam\\.gserviceaccount\\.com",
          "firebasestorage\\.serviceAgent/serviceAccount:service-(?:\\d*)@gcp-sa-firebasestorage\\.iam\\.gserviceaccount\\.com",
          "firestore\\.serviceAgent/serviceAccount:service-(?:\\d*)@gcp-sa-firestore\\.iam\\.gserviceaccount\\.com",
          "healthcare\\.serviceAgent/serviceAccount:service-(?:\\d*)@gcp-sa-healthcare\\.iam\\.gserviceaccount\\.com",
          "iap\\.settingsAdmin/serviceAccount:(?:\\d*)-compute@developer\\.gserviceaccount\\.com",
          "identitytoolkit\\.viewer/serviceAccount:(?:\\d*)-compute@developer\\.gserviceaccount\\.com",
          "integrations\\.serviceAgent/serviceAccount:service-(?:\\d*)@gcp-sa-integrations\\.iam\\.gserviceaccount\\.com",
          "lifesciences\\.serviceAgent/serviceAccount:service-(?:\\d*)@gcp-sa-lifesciences\\.iam\\.gserviceaccount\\.com",
          "logging\\.serviceAgent/serviceAccount:service-(?:\\d*)@gcp-sa-logging\\.iam\\.gserviceaccount\\.com",
          "ml\\.serviceAgent/serviceAccount:service-(?:\\d*)@cloud-ml\\.google\\.com\\.iam\\.gserviceaccount\\.com",
          "ml\\.serviceAgent/serviceAccount:service-(?:\\d*)@cloud-ml\\.iam\\.gserviceaccount\\.com",
          "monitoring\\.notificationServiceAgent/serviceAccount:service-(?:\\d*)@gcp-sa-monitoring-notification\\.iam\\.gserviceaccount\\.com",
          "networkmanagement\\.serviceAgent/serviceAccount:service-(?:\\d*)@gcp-sa-networkmanagement\\.iam\\.gserviceaccount\\.com",
          "notebooks\\.serviceAgent/serviceAccount:service-(?:\\d*)@gcp-sa-notebooks\\.iam\\.gserviceaccount\\.com",
          "osconfig\\.serviceAgent/serviceAccount:service-(?:\\d*)@gcp-sa-osconfig\\.iam\\.gserviceaccount\\.com",
          "pubsub\\.serviceAgent/serviceAccount:service-(?:\\d*)@gcp-sa-pubsub\\.iam\\.gserviceaccount\\.com",
          "redis\\.serviceAgent/serviceAccount:service-(?:\\d*)@cloud-redis\\.iam\\.gserviceaccount\\.com",
          "run\\.serviceAgent/serviceAccount:service-(?:\\d*)@serverless-robot-prod\\.iam\\.gserviceaccount\\.com",
          "securitycenter\\.serviceAgent/serviceAccount:service-org-(?:\\d*)@security-center-api\\.iam\\.gserviceaccount\\.com",
          "securitycenter\\.serviceAgent/serviceAccount:service-project-(?:\\d*)@security-center-api\\.iam\\.gserviceaccount\\.com",
          "servicenetworking\\.serviceAgent/serviceAccount:service-(?:\\d*)@gcp-sa-cloudasset\\.iam\\.gserviceaccount\\.com",
          "servicenetworking\\.serviceAgent/serviceAccount:service-(?:\\d*)@service-networking\\.iam\\.gserviceaccount\\.com",
          "spanner\\.serviceAgent/serviceAccount:(?:\\d*)-compute@developer\\.gserviceaccount\\.com",
          "storage\\.admin/serviceAccount:cloud-data-pipeline@koi-b2637a0100e14f34c8c1-tp\\.iam\\.gserviceaccount\\.com",
          "storage\\.admin/serviceAccount:project-(?:\\d*)@storage-transfer-service\\.iam\\.gserviceaccount\\.com",
          "storage\\.objectViewer/serviceAccount:project-(?:\\d*)@storage-transfer-service\\.iam\\.gserviceaccount\\.com",
          "storageinsights\\.serviceAgent/serviceAccount:service-(?:\\d*)@gcp-sa-storageinsights\\.iam\\.gserviceaccount\\.com",
          "storagetransfer\\.serviceAgent/serviceAccount:project-(?:\\d*)@storage-transfer-service\\.iam\\.gserviceaccount\\.com",
          "tpu\\.serviceAgent/serviceAccount:service-(?:\\d*)@cloud-tpu\\.iam\\.gserviceaccount\\.com",
          "vpcaccess\\.serviceAgent/serviceAccount:service-(?:\\d*)@gcp-sa-vpcaccess\\.iam\\.gserviceaccount\\.com",
          "websecurityscanner\\.serviceAgent/serviceAccount:service-(?:\\d*)@gcp-sa-websecurityscanner\\.iam\\.gserviceaccount\\.com",
          "workflows\\.serviceAgent/serviceAccount:service-(?:\\d*)@gcp-sa-workflows\\.iam\\.gserviceaccount\\.com",
          "workstations\\.serviceAgent/serviceAccount:service-(?:\\d*)@gcp-sa-workstations\\.iam\\.gserviceaccount\\.com");

  private final List<Pattern> patterns;

  public DefaultServiceAgentFilter() {
    this(DEFAULT_GRANT_PATTERNS);
  }

  public DefaultServiceAgentFilter(List<String> patterns) {
    this.patterns =
        patterns.stream().map(Pattern::compile).collect(ImmutableList.toImmutableList());
  }

  public boolean isDefaultGrant(String uri) {
    return patterns.stream().anyMatch(pattern -> pattern.matcher(uri).find());
  }

  /** The URIs that are not default service agent grants, in their original order. */
  public List<String> withoutDefaultGrants(Collection<String> uris) {
    return uris.stream().filter(uri -> !isDefaultGrant(uri)).collect(Collectors.toList());
  }
}
