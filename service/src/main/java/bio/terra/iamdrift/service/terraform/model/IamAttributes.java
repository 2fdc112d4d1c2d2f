package bio.terra.iamdrift.service.terraform.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Attributes of a google_*_iam_binding or google_*_iam_member instance. Bindings carry {@code
 * members}, memberships carry {@code member}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IamAttributes(
    @Nullable String id,
    @Nullable List<String> members,
    @Nullable String member,
    @Nullable String folder,
    @Nullable String project,
    @Nullable String role) {}
