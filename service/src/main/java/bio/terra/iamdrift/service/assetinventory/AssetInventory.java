package bio.terra.iamdrift.service.assetinventory;

import bio.terra.iamdrift.service.assetinventory.model.AssetIam;
import bio.terra.iamdrift.service.assetinventory.model.HierarchyNode;
import bio.terra.iamdrift.service.assetinventory.model.NodeType;
import java.util.List;
import javax.annotation.Nullable;

/** Read access to the cloud asset catalog. Split out so tests can supply an in-memory catalog. */
public interface AssetInventory {

  /** Names of the storage buckets in the organization matching the query. */
  List<String> buckets(String organizationId, @Nullable String query);

  /** Active folders or projects of the organization. */
  List<HierarchyNode> hierarchyAssets(String organizationId, NodeType assetType);

  /** Every IAM grant matching the search, one entry per binding and member. */
  List<AssetIam> iam(IamSearchOptions options);
}
