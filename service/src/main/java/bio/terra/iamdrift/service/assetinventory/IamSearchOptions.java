package bio.terra.iamdrift.service.assetinventory;

import java.util.List;
import javax.annotation.Nullable;

/**
 * Parameters of an IAM policy search.
 *
 * @param scope search scope, e.g. organizations/123
 * @param query asset inventory query; null or empty matches every policy in scope
 * @param assetTypes asset types whose policies are returned; empty means all types
 */
public record IamSearchOptions(String scope, @Nullable String query, List<String> assetTypes) {}
