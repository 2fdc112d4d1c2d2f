package bio.terra.iamdrift.service.drift.model;

import bio.terra.iamdrift.service.assetinventory.model.AssetIam;
import com.google.common.collect.ImmutableSortedMap;
import java.util.Map;

/**
 * Drift between live IAM and Terraform state, keyed and sorted by canonical URI.
 *
 * @param clickOpsChanges grants present in Google Cloud but not declared in Terraform
 * @param missingTerraformChanges grants declared in Terraform but absent from Google Cloud
 */
public record IamDrift(
    Map<String, AssetIam> clickOpsChanges,
    Map<String, TerraformStateIamSource> missingTerraformChanges) {

  public IamDrift {
    clickOpsChanges = ImmutableSortedMap.copyOf(clickOpsChanges);
    missingTerraformChanges = ImmutableSortedMap.copyOf(missingTerraformChanges);
  }

  public boolean hasDrift() {
    return !clickOpsChanges.isEmpty() || !missingTerraformChanges.isEmpty();
  }
}
