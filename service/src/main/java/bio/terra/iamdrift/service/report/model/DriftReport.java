package bio.terra.iamdrift.service.report.model;

import java.util.List;

public record DriftReport(
    String organizationId,
    List<DriftReportEntry> clickOpsChanges,
    List<DriftReportEntry> missingTerraformChanges) {}
