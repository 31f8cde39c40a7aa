package io.intellixity.ybadapter.jdbc.yugabyte;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.intellixity.ybadapter.error.ConfigValidationException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads {@link YugabyteCredentials} from a profiles YAML document:\n
 *
 * <pre>
 * my_project:
 *   target: dev
 *   outputs:
 *     dev:
 *       type: yugabytedb
 *       host: localhost
 *       ...
 * </pre>
 */
public final class YugabyteCredentialsLoader {
  private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

  public YugabyteCredentials load(Path profilesFile, String profile, String target) throws IOException {
    Objects.requireNonNull(profilesFile, "profilesFile");
    try (InputStream in = Files.newInputStream(profilesFile)) {
      return load(in, profile, target);
    }
  }

  /** Resolve {@code profile}; a null {@code target} selects the profile's default target. */
  public YugabyteCredentials load(InputStream in, String profile, String target) throws IOException {
    Objects.requireNonNull(in, "in");
    Objects.requireNonNull(profile, "profile");
    JsonNode root = YAML.readTree(in);
    if (root == null || !root.hasNonNull(profile)) {
      throw new ConfigValidationException("Profile '" + profile + "' not found");
    }
    JsonNode p = root.get(profile);
    String t = (target != null && !target.isBlank()) ? target : p.path("target").asText(null);
    if (t == null || t.isBlank()) {
      throw new ConfigValidationException("Profile '" + profile + "' declares no target and none was given");
    }
    JsonNode output = p.path("outputs").get(t);
    if (output == null || output.isNull()) {
      throw new ConfigValidationException("Target '" + t + "' not found in profile '" + profile + "'");
    }
    String type = output.path("type").asText("");
    if (!YugabyteCredentials.TYPE.equals(type)) {
      throw new ConfigValidationException("Target '" + t + "' has type '" + type + "', expected '"
          + YugabyteCredentials.TYPE + "'");
    }
    try {
      return YAML.treeToValue(output, YugabyteCredentials.class);
    } catch (JsonProcessingException e) {
      throw new ConfigValidationException("Invalid credentials for target '" + t + "': " + e.getOriginalMessage(), e);
    }
  }
}
