package bio.terra.iamdrift.service.terraform;

import bio.terra.iamdrift.service.assetinventory.HierarchyLookup;
import bio.terra.iamdrift.service.assetinventory.model.AssetIam;
import java.util.List;
import java.util.Map;

/** Reads IAM grants declared in Terraform state files stored in object storage. */
public interface TerraformStateParser {

  /** gs:// URIs of every default.tfstate object in the given buckets. */
  List<String> stateFileUris(List<String> buckets);

  /**
   * Extract the IAM grants of the organization, folder and project IAM binding and member
   * resources in each state file.
   *
   * @param gcsUris state files to read
   * @param hierarchy folders and projects used to resolve the resource references in the states
   * @return grants keyed by state file URI
   */
  Map<String, List<AssetIam>> processStates(List<String> gcsUris, HierarchyLookup hierarchy);

  /** Whether the state file declares no resources at all. */
  boolean stateWithoutResources(String gcsUri);
}
