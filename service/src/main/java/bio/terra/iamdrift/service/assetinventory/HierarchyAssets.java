package bio.terra.iamdrift.service.assetinventory;

import bio.terra.iamdrift.service.assetinventory.model.HierarchyNode;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/** Lookup tables over lists of hierarchy nodes. */
public class HierarchyAssets {

  private HierarchyAssets() {}

  public static Map<String, HierarchyNode> byId(Collection<HierarchyNode> nodes) {
    Map<String, HierarchyNode> result = new LinkedHashMap<>();
    nodes.forEach(node -> result.put(node.id(), node));
    return result;
  }

  /** Nodes keyed by name. When two nodes share a name the later one wins. */
  public static Map<String, HierarchyNode> byName(Map<String, HierarchyNode> nodesById) {
    Map<String, HierarchyNode> result = new LinkedHashMap<>();
    nodesById.values().forEach(node -> result.put(node.name(), node));
    return result;
  }

  /** Union of two id-keyed maps. On an id collision the node from {@code b} wins. */
  public static Map<String, HierarchyNode> merge(
      Map<String, HierarchyNode> a, Map<String, HierarchyNode> b) {
    Map<String, HierarchyNode> result = new LinkedHashMap<>(a);
    result.putAll(b);
    return result;
  }
}
