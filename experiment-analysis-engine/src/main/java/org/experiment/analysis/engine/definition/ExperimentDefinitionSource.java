package org.experiment.analysis.engine.definition;

import java.io.IOException;
import java.util.List;

public interface ExperimentDefinitionSource {
  List<ExperimentRefreshDefinition> getAllDefinitions() throws IOException;
}
