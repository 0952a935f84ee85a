package org.experiment.analysis.engine.definition;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.experiment.analysis.datamodel.json.ObjectMapperProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Reads refresh definitions from a JSON file holding an array of definitions. */
public class FSExperimentDefinitionSource implements ExperimentDefinitionSource {
  private static final Logger LOGGER = LoggerFactory.getLogger(FSExperimentDefinitionSource.class);
  private static final ObjectMapper OBJECT_MAPPER = ObjectMapperProvider.get();
  private static final String PATH_CONFIG = "path";

  private final String path;

  public FSExperimentDefinitionSource(Config fsConfig) {
    this.path = fsConfig.getString(PATH_CONFIG);
  }

  @Override
  public List<ExperimentRefreshDefinition> getAllDefinitions() throws IOException {
    LOGGER.debug("Reading experiment definitions from file path:{}", path);
    JsonNode jsonNode = OBJECT_MAPPER.readTree(new File(path).getAbsoluteFile());
    if (!jsonNode.isArray()) {
      throw new IOException("File should contain an array of experiment definitions");
    }

    List<ExperimentRefreshDefinition> definitions = new ArrayList<>();
    for (JsonNode node : jsonNode) {
      ExperimentRefreshDefinition definition =
          OBJECT_MAPPER.treeToValue(node, ExperimentRefreshDefinition.class);
      if (definition.getSettings() == null || definition.getSettings().getExperimentId() == null) {
        LOGGER.error("Skipping experiment definition without experimentId: {}", node);
        continue;
      }
      definitions.add(definition);
    }
    return definitions;
  }
}
