package bio.terra.iamdrift.service.terraform.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record InstanceState(IamAttributes attributes) {}
