package bio.terra.iamdrift.service.terraform.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/** The parts of a Terraform JSON state file that IAM extraction reads. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TerraformState(List<ResourceState> resources) {}
