package bio.terra.iamdrift.service.drift.model;

import bio.terra.iamdrift.service.assetinventory.model.AssetIam;

/**
 * An IAM grant declared in Terraform state.
 *
 * @param assetIam the grant
 * @param stateFileUri gs:// URI of the state file declaring it
 */
public record TerraformStateIamSource(AssetIam assetIam, String stateFileUri) {}
