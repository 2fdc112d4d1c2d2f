package bio.terra.iamdrift.service.report.model;

import bio.terra.iamdrift.service.assetinventory.model.AssetIam;
import bio.terra.iamdrift.service.assetinventory.model.IamCondition;
import bio.terra.iamdrift.service.assetinventory.model.NodeType;
import javax.annotation.Nullable;

/** One drifted grant in the JSON report. */
public record DriftReportEntry(
    String uri,
    String resourceId,
    NodeType resourceType,
    String role,
    String member,
    @Nullable IamCondition condition,
    @Nullable String stateFileUri) {

  public static DriftReportEntry of(String uri, AssetIam iam, @Nullable String stateFileUri) {
    return new DriftReportEntry(
        uri,
        iam.resourceId(),
        iam.resourceType(),
        iam.role(),
        iam.member(),
        iam.condition(),
        stateFileUri);
  }
}
