package bio.terra.iamdrift.service.assetinventory.model;

/** Condition attached to a conditional IAM binding. */
public record IamCondition(String title, String expression, String description) {}
