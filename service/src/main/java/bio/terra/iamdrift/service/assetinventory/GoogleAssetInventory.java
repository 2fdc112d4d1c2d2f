package bio.terra.iamdrift.service.assetinventory;

import bio.terra.iamdrift.common.exception.AssetInventoryException;
import bio.terra.iamdrift.service.assetinventory.model.AssetIam;
import bio.terra.iamdrift.service.assetinventory.model.HierarchyNode;
import bio.terra.iamdrift.service.assetinventory.model.IamCondition;
import bio.terra.iamdrift.service.assetinventory.model.NodeType;
import com.google.api.gax.rpc.ApiException;
import com.google.cloud.asset.v1.AssetServiceClient;
import com.google.cloud.asset.v1.IamPolicySearchResult;
import com.google.cloud.asset.v1.ResourceSearchResult;
import com.google.cloud.asset.v1.SearchAllIamPoliciesRequest;
import com.google.cloud.asset.v1.SearchAllResourcesRequest;
import com.google.common.annotations.VisibleForTesting;
import com.google.iam.v1.Binding;
import com.google.protobuf.FieldMask;
import com.google.type.Expr;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.annotation.Nullable;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** {@link AssetInventory} backed by the Cloud Asset Inventory search APIs. */
@Component
public class GoogleAssetInventory implements AssetInventory {
  private static final Logger logger = LoggerFactory.getLogger(GoogleAssetInventory.class);

  public static final String BUCKET_ASSET_TYPE = "storage.googleapis.com/Bucket";
  private static final String BUCKET_NAME_PREFIX = "//storage.googleapis.com/";
  private static final String ACTIVE_STATE_QUERY = "state:ACTIVE";

  // e.g. //cloudresourcemanager.googleapis.com/projects/my-project-name
  private static final Pattern RESOURCE_NAME_PATTERN =
      Pattern.compile(
          "//cloudresourcemanager\\.googleapis\\.com/(?:folders|organizations|projects)/(.*)");
  // e.g. //cloudresourcemanager.googleapis.com/folders/234234233233
  private static final Pattern PARENT_ID_PATTERN =
      Pattern.compile("//cloudresourcemanager\\.googleapis\\.com/(?:folders|organizations)/(\\d*)");

  // Resolved on first use so that building the application context needs no credentials.
  private final ObjectProvider<AssetServiceClient> assetServiceClient;

  @Autowired
  public GoogleAssetInventory(ObjectProvider<AssetServiceClient> assetServiceClient) {
    this.assetServiceClient = assetServiceClient;
  }

  @Override
  public List<String> buckets(String organizationId, @Nullable String query) {
    SearchAllResourcesRequest.Builder request =
        SearchAllResourcesRequest.newBuilder()
            .setScope(organizationScope(organizationId))
            .addAssetTypes(BUCKET_ASSET_TYPE)
            .setReadMask(FieldMask.newBuilder().addPaths("name"));
    if (StringUtils.isNotEmpty(query)) {
      request.setQuery(query);
    }

    List<String> buckets = new ArrayList<>();
    try {
      for (ResourceSearchResult resource :
          assetServiceClient.getObject().searchAllResources(request.build()).iterateAll()) {
        buckets.add(StringUtils.removeStart(resource.getName(), BUCKET_NAME_PREFIX));
      }
    } catch (ApiException e) {
      throw new AssetInventoryException(
          String.format("failed to search buckets in organization %s", organizationId), e);
    }
    logger.debug("Found {} buckets in organization {}", buckets.size(), organizationId);
    return buckets;
  }

  @Override
  public List<HierarchyNode> hierarchyAssets(String organizationId, NodeType assetType) {
    if (assetType != NodeType.FOLDER && assetType != NodeType.PROJECT) {
      throw new AssetInventoryException(
          "Hierarchy assets are only folders or projects, not " + assetType);
    }
    SearchAllResourcesRequest request =
        SearchAllResourcesRequest.newBuilder()
            .setScope(organizationScope(organizationId))
            .addAssetTypes(assetType.getAssetType())
            .setQuery(ACTIVE_STATE_QUERY)
            .build();

    List<HierarchyNode> nodes = new ArrayList<>();
    try {
      for (ResourceSearchResult resource :
          assetServiceClient.getObject().searchAllResources(request).iterateAll()) {
        nodes.add(toHierarchyNode(resource));
      }
    } catch (ApiException e) {
      throw new AssetInventoryException(
          String.format("failed to search %s assets in organization %s", assetType, organizationId),
          e);
    }
    return nodes;
  }

  @Override
  public List<AssetIam> iam(IamSearchOptions options) {
    SearchAllIamPoliciesRequest.Builder request =
        SearchAllIamPoliciesRequest.newBuilder()
            .setScope(options.scope())
            .addAllAssetTypes(options.assetTypes());
    if (StringUtils.isNotEmpty(options.query())) {
      request.setQuery(options.query());
    }

    List<AssetIam> results = new ArrayList<>();
    try {
      for (IamPolicySearchResult policy :
          assetServiceClient.getObject().searchAllIamPolicies(request.build()).iterateAll()) {
        results.addAll(toAssetIam(policy));
      }
    } catch (ApiException e) {
      throw new AssetInventoryException(
          String.format("failed to search IAM policies in scope %s", options.scope()), e);
    }
    return results;
  }

  @VisibleForTesting
  static HierarchyNode toHierarchyNode(ResourceSearchResult resource) {
    // e.g. cloudresourcemanager.googleapis.com/Folder
    NodeType nodeType = NodeType.fromValue(resource.getAssetType());
    String id;
    if (nodeType == NodeType.FOLDER && resource.getFoldersCount() > 0) {
      id = StringUtils.removeStart(resource.getFolders(0), "folders/");
    } else if (nodeType == NodeType.PROJECT) {
      id = StringUtils.removeStart(resource.getProject(), "projects/");
    } else {
      throw new AssetInventoryException(
          String.format(
              "failed to determine ID of %s asset %s",
              resource.getAssetType(), resource.getName()));
    }
    return new HierarchyNode(
        id,
        extractFirstGroup(RESOURCE_NAME_PATTERN, resource.getName(), "name"),
        extractFirstGroup(PARENT_ID_PATTERN, resource.getParentFullResourceName(), "parent ID"),
        NodeType.fromValue(resource.getParentAssetType()),
        nodeType);
  }

  @VisibleForTesting
  static List<AssetIam> toAssetIam(IamPolicySearchResult policy) {
    String resourceId;
    NodeType resourceType;
    if (StringUtils.isNotEmpty(policy.getProject())) {
      resourceId = StringUtils.removeStart(policy.getProject(), "projects/");
      resourceType = NodeType.PROJECT;
    } else if (policy.getFoldersCount() > 0) {
      resourceId = StringUtils.removeStart(policy.getFolders(0), "folders/");
      resourceType = NodeType.FOLDER;
    } else {
      resourceId = StringUtils.removeStart(policy.getOrganization(), "organizations/");
      resourceType = NodeType.ORGANIZATION;
    }

    List<AssetIam> grants = new ArrayList<>();
    for (Binding binding : policy.getPolicy().getBindingsList()) {
      IamCondition condition = null;
      if (binding.hasCondition()) {
        Expr expr = binding.getCondition();
        condition = new IamCondition(expr.getTitle(), expr.getExpression(), expr.getDescription());
      }
      for (String member : binding.getMembersList()) {
        grants.add(new AssetIam(resourceId, resourceType, member, binding.getRole(), condition));
      }
    }
    return grants;
  }

  private static String extractFirstGroup(Pattern pattern, String resourceName, String what) {
    Matcher matcher = pattern.matcher(resourceName);
    if (!matcher.find()) {
      throw new AssetInventoryException(
          String.format("failed to parse %s from resource name: %s", what, resourceName));
    }
    return matcher.group(1);
  }

  private static String organizationScope(String organizationId) {
    return "organizations/" + organizationId;
  }
}
