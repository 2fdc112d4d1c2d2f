package bio.terra.iamdrift.service.terraform.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One resource block of a state file. Instances are kept as raw JSON and only decoded for the IAM
 * resource types.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResourceState(String type, JsonNode instances) {}
