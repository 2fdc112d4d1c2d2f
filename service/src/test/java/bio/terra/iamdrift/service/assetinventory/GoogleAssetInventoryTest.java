package bio.terra.iamdrift.service.assetinventory;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

import bio.terra.iamdrift.common.BaseUnitTest;
import bio.terra.iamdrift.common.exception.AssetInventoryException;
import bio.terra.iamdrift.service.assetinventory.model.AssetIam;
import bio.terra.iamdrift.service.assetinventory.model.HierarchyNode;
import bio.terra.iamdrift.service.assetinventory.model.IamCondition;
import bio.terra.iamdrift.service.assetinventory.model.NodeType;
import com.google.cloud.asset.v1.IamPolicySearchResult;
import com.google.cloud.asset.v1.ResourceSearchResult;
import com.google.iam.v1.Binding;
import com.google.iam.v1.Policy;
import com.google.type.Expr;
import java.util.List;
import org.junit.jupiter.api.Test;

public class GoogleAssetInventoryTest extends BaseUnitTest {
  private static final String EXPIRY = "request.time < timestamp(\"2030-01-01T00:00:00Z\")";

  @Test
  void toHierarchyNode_folder() {
    ResourceSearchResult resource =
        ResourceSearchResult.newBuilder()
            .setName("//cloudresourcemanager.googleapis.com/folders/234234233233")
            .setAssetType("cloudresourcemanager.googleapis.com/Folder")
            .addFolders("folders/234234233233")
            .addFolders("folders/111")
            .setParentFullResourceName("//cloudresourcemanager.googleapis.com/folders/111")
            .setParentAssetType("cloudresourcemanager.googleapis.com/Folder")
            .build();

    HierarchyNode node = GoogleAssetInventory.toHierarchyNode(resource);

    assertThat(
        node,
        equalTo(
            new HierarchyNode(
                "234234233233", "234234233233", "111", NodeType.FOLDER, NodeType.FOLDER)));
  }

  @Test
  void toHierarchyNode_project() {
    ResourceSearchResult resource =
        ResourceSearchResult.newBuilder()
            .setName("//cloudresourcemanager.googleapis.com/projects/my-project-name")
            .setAssetType("cloudresourcemanager.googleapis.com/Project")
            .setProject("projects/45234234234")
            .setParentFullResourceName("//cloudresourcemanager.googleapis.com/organizations/99")
            .setParentAssetType("cloudresourcemanager.googleapis.com/Organization")
            .build();

    HierarchyNode node = GoogleAssetInventory.toHierarchyNode(resource);

    assertThat(node.id(), equalTo("45234234234"));
    assertThat(node.name(), equalTo("my-project-name"));
    assertThat(node.parentId(), equalTo("99"));
    assertThat(node.parentType(), equalTo(NodeType.ORGANIZATION));
    assertThat(node.nodeType(), equalTo(NodeType.PROJECT));
  }

  @Test
  void toHierarchyNode_unparseableName_throws() {
    ResourceSearchResult resource =
        ResourceSearchResult.newBuilder()
            .setName("//compute.googleapis.com/projects/p/zones/z/instances/i")
            .setAssetType("cloudresourcemanager.googleapis.com/Project")
            .setProject("projects/1")
            .setParentFullResourceName("//cloudresourcemanager.googleapis.com/organizations/99")
            .build();

    assertThrows(
        AssetInventoryException.class, () -> GoogleAssetInventory.toHierarchyNode(resource));
  }

  @Test
  void toAssetIam_projectPolicy_expandsBindingsAndMembers() {
    IamPolicySearchResult policy =
        IamPolicySearchResult.newBuilder()
            .setResource("//cloudresourcemanager.googleapis.com/projects/my-project")
            .setProject("projects/1231232222")
            .addFolders("folders/123123123123")
            .setOrganization("organizations/1231231")
            .setPolicy(
                Policy.newBuilder()
                    .addBindings(
                        Binding.newBuilder()
                            .setRole("roles/viewer")
                            .addMembers("user:a@google.com")
                            .addMembers("group:b@google.com"))
                    .addBindings(
                        Binding.newBuilder()
                            .setRole("roles/owner")
                            .addMembers("user:a@google.com")
                            .setCondition(
                                Expr.newBuilder()
                                    .setTitle("expires")
                                    .setExpression(EXPIRY)
                                    .setDescription("temporary access"))))
            .build();

    List<AssetIam> grants = GoogleAssetInventory.toAssetIam(policy);

    assertThat(
        grants,
        contains(
            new AssetIam("1231232222", NodeType.PROJECT, "user:a@google.com", "roles/viewer"),
            new AssetIam("1231232222", NodeType.PROJECT, "group:b@google.com", "roles/viewer"),
            new AssetIam(
                "1231232222",
                NodeType.PROJECT,
                "user:a@google.com",
                "roles/owner",
                new IamCondition("expires", EXPIRY, "temporary access"))));
  }

  @Test
  void toAssetIam_folderAndOrganizationPolicies() {
    IamPolicySearchResult folderPolicy =
        IamPolicySearchResult.newBuilder()
            .addFolders("folders/123123123123")
            .setOrganization("organizations/1231231")
            .setPolicy(
                Policy.newBuilder()
                    .addBindings(
                        Binding.newBuilder()
                            .setRole("roles/viewer")
                            .addMembers("user:a@google.com")))
            .build();
    IamPolicySearchResult orgPolicy =
        IamPolicySearchResult.newBuilder()
            .setOrganization("organizations/1231231")
            .setPolicy(
                Policy.newBuilder()
                    .addBindings(
                        Binding.newBuilder()
                            .setRole("roles/browser")
                            .addMembers("user:a@google.com")))
            .build();

    AssetIam folderGrant = GoogleAssetInventory.toAssetIam(folderPolicy).get(0);
    AssetIam orgGrant = GoogleAssetInventory.toAssetIam(orgPolicy).get(0);

    assertThat(folderGrant.resourceType(), equalTo(NodeType.FOLDER));
    assertThat(folderGrant.resourceId(), equalTo("123123123123"));
    assertThat(folderGrant.condition(), nullValue());
    assertThat(orgGrant.resourceType(), equalTo(NodeType.ORGANIZATION));
    assertThat(orgGrant.resourceId(), equalTo("1231231"));
  }
}
