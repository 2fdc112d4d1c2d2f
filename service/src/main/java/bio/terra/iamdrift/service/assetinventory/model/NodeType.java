package bio.terra.iamdrift.service.assetinventory.model;

import com.fasterxml.jackson.annotation.JsonValue;
import javax.annotation.Nullable;
import org.apache.commons.lang3.StringUtils;

/** Kind of node in the Google Cloud resource hierarchy. */
public enum NodeType {
  ORGANIZATION("Organization", "cloudresourcemanager.googleapis.com/Organization"),
  FOLDER("Folder", "cloudresourcemanager.googleapis.com/Folder"),
  PROJECT("Project", "cloudresourcemanager.googleapis.com/Project"),
  /** A reference that could not be matched to a live folder or project, e.g. a deleted folder. */
  UNKNOWN("Unknown", null);

  public static final String RESOURCE_MANAGER_ASSET_PREFIX = "cloudresourcemanager.googleapis.com/";

  private final String value;
  private final String assetType;

  NodeType(String value, @Nullable String assetType) {
    this.value = value;
    this.assetType = assetType;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  /** Cloud Asset Inventory type name, e.g. cloudresourcemanager.googleapis.com/Folder */
  @Nullable
  public String getAssetType() {
    return assetType;
  }

  /**
   * Map an asset inventory type, with or without the resource manager prefix, to a node type.
   * Anything unrecognized is {@link #UNKNOWN}.
   */
  public static NodeType fromValue(@Nullable String value) {
    String shortName = StringUtils.removeStart(value, RESOURCE_MANAGER_ASSET_PREFIX);
    for (NodeType nodeType : values()) {
      if (StringUtils.equals(nodeType.value, shortName)) {
        return nodeType;
      }
    }
    return UNKNOWN;
  }

  @Override
  public String toString() {
    return value;
  }
}
