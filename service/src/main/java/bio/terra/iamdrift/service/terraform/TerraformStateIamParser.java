package bio.terra.iamdrift.service.terraform;

import bio.terra.iamdrift.app.configuration.external.GcsConfiguration;
import bio.terra.iamdrift.common.exception.ObjectStorageException;
import bio.terra.iamdrift.common.exception.TerraformStateException;
import bio.terra.iamdrift.service.assetinventory.HierarchyLookup;
import bio.terra.iamdrift.service.assetinventory.model.AssetIam;
import bio.terra.iamdrift.service.assetinventory.model.HierarchyNode;
import bio.terra.iamdrift.service.assetinventory.model.NodeType;
import bio.terra.iamdrift.service.storage.GcsUri;
import bio.terra.iamdrift.service.storage.ObjectStorage;
import bio.terra.iamdrift.service.terraform.model.IamAttributes;
import bio.terra.iamdrift.service.terraform.model.InstanceState;
import bio.terra.iamdrift.service.terraform.model.ResourceState;
import bio.terra.iamdrift.service.terraform.model.TerraformState;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.io.ByteStreams;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Extracts IAM grants from Terraform JSON state files. Only the six google organization, folder
 * and project IAM binding and member resource types are read; everything else in the state is
 * skipped.
 *
 * <p>Folder and project references in the state may be ids or names. They are resolved against
 * the live hierarchy; a reference that cannot be resolved, usually a deleted folder or project,
 * produces a grant of type {@link NodeType#UNKNOWN} that keeps the original reference as its id.
 */
@Component
public class TerraformStateIamParser implements TerraformStateParser {
  private static final Logger logger = LoggerFactory.getLogger(TerraformStateIamParser.class);

  public static final String STATE_FILE_NAME = "default.tfstate";
  private static final String NO_RESOURCES_MARKER = "\"resources\": [],";
  private static final TypeReference<List<InstanceState>> INSTANCES_TYPE =
      new TypeReference<>() {};

  private final ObjectStorage objectStorage;
  private final ObjectMapper objectMapper;
  private final long stateFileSizeLimitBytes;

  @Autowired
  public TerraformStateIamParser(
      ObjectStorage objectStorage, ObjectMapper objectMapper, GcsConfiguration gcsConfiguration) {
    this.objectStorage = objectStorage;
    this.objectMapper = objectMapper;
    this.stateFileSizeLimitBytes = gcsConfiguration.getStateFileSizeLimitBytes();
  }

  @Override
  public List<String> stateFileUris(List<String> buckets) {
    List<String> uris = new ArrayList<>();
    for (String bucket : buckets) {
      uris.addAll(objectStorage.objectsWithName(bucket, STATE_FILE_NAME));
    }
    return uris;
  }

  @Override
  public Map<String, List<AssetIam>> processStates(
      List<String> gcsUris, HierarchyLookup hierarchy) {
    Map<String, List<AssetIam>> result = new LinkedHashMap<>();
    for (String uri : gcsUris) {
      TerraformState state = readState(uri);
      result.put(uri, parseStateIam(uri, state, hierarchy));
    }
    return result;
  }

  @Override
  public boolean stateWithoutResources(String gcsUri) {
    GcsUri parsed = GcsUri.parse(gcsUri);
    try (InputStream in = objectStorage.downloadObject(parsed.bucket(), parsed.name())) {
      byte[] data = ByteStreams.toByteArray(ByteStreams.limit(in, stateFileSizeLimitBytes));
      return new String(data, StandardCharsets.UTF_8).contains(NO_RESOURCES_MARKER);
    } catch (IOException | ObjectStorageException e) {
      throw new TerraformStateException("failed to read terraform state " + gcsUri, e);
    }
  }

  private TerraformState readState(String uri) {
    GcsUri parsed = GcsUri.parse(uri);
    try (InputStream in = objectStorage.downloadObject(parsed.bucket(), parsed.name())) {
      return objectMapper.readValue(
          ByteStreams.limit(in, stateFileSizeLimitBytes), TerraformState.class);
    } catch (ObjectStorageException e) {
      throw new TerraformStateException("failed to read terraform state " + uri, e);
    } catch (IOException e) {
      throw new TerraformStateException("failed to decode terraform state " + uri, e);
    }
  }

  @VisibleForTesting
  List<AssetIam> parseStateIam(String uri, TerraformState state, HierarchyLookup hierarchy) {
    List<AssetIam> grants = new ArrayList<>();
    if (state == null || state.resources() == null) {
      return grants;
    }
    for (ResourceState resource : state.resources()) {
      Optional<IamResourceType> iamType = IamResourceType.fromTerraformType(resource.type());
      if (iamType.isEmpty() || resource.instances() == null) {
        continue;
      }
      List<InstanceState> instances;
      try {
        instances = objectMapper.convertValue(resource.instances(), INSTANCES_TYPE);
      } catch (IllegalArgumentException e) {
        throw new TerraformStateException(
            String.format("failed to decode %s instances in %s", resource.type(), uri), e);
      }
      for (InstanceState instance : instances) {
        if (instance == null || instance.attributes() == null) {
          continue;
        }
        grants.addAll(toGrants(uri, iamType.get(), instance.attributes(), hierarchy));
      }
    }
    return grants;
  }

  private List<AssetIam> toGrants(
      String uri, IamResourceType iamType, IamAttributes attributes, HierarchyLookup hierarchy) {
    List<String> members;
    if (iamType.binding) {
      members = Optional.ofNullable(attributes.members()).orElse(List.of());
    } else {
      members = attributes.member() == null ? List.of() : List.of(attributes.member());
    }
    if (members.isEmpty()) {
      return List.of();
    }

    String resourceId;
    NodeType resourceType;
    if (iamType.scope == NodeType.ORGANIZATION) {
      resourceId = hierarchy.getOrganizationId();
      resourceType = NodeType.ORGANIZATION;
    } else {
      String reference =
          iamType.scope == NodeType.FOLDER
              ? StringUtils.removeStart(attributes.folder(), "folders/")
              : attributes.project();
      reference = StringUtils.defaultString(reference);
      Optional<HierarchyNode> node = hierarchy.resolve(reference);
      if (node.isPresent()) {
        resourceId = node.get().id();
        resourceType = node.get().nodeType();
      } else {
        logger.warn(
            "Failed to locate {} {} referenced by {}, it may have been deleted",
            StringUtils.lowerCase(iamType.scope.getValue()),
            reference,
            uri);
        resourceId = reference;
        resourceType = NodeType.UNKNOWN;
      }
    }

    List<AssetIam> grants = new ArrayList<>();
    for (String member : members) {
      grants.add(new AssetIam(resourceId, resourceType, member, attributes.role()));
    }
    return grants;
  }

  /** The Terraform resource types that carry IAM grants. */
  private enum IamResourceType {
    ORGANIZATION_BINDING("google_organization_iam_binding", NodeType.ORGANIZATION, true),
    FOLDER_BINDING("google_folder_iam_binding", NodeType.FOLDER, true),
    PROJECT_BINDING("google_project_iam_binding", NodeType.PROJECT, true),
    ORGANIZATION_MEMBER("google_organization_iam_member", NodeType.ORGANIZATION, false),
    FOLDER_MEMBER("google_folder_iam_member", NodeType.FOLDER, false),
    PROJECT_MEMBER("google_project_iam_member", NodeType.PROJECT, false);

    private final String terraformType;
    private final NodeType scope;
    private final boolean binding;

    IamResourceType(String terraformType, NodeType scope, boolean binding) {
      this.terraformType = terraformType;
      this.scope = scope;
      this.binding = binding;
    }

    static Optional<IamResourceType> fromTerraformType(String type) {
      return Arrays.stream(values())
          .filter(value -> StringUtils.equals(value.terraformType, type))
          .findFirst();
    }
  }
}
