package org.experiment.analysis.notification.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.Striped;
import com.typesafe.config.Config;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.regex.Pattern;
import org.experiment.analysis.datamodel.experiment.ExperimentDocument;
import org.experiment.analysis.datamodel.json.ObjectMapperProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps one {@code <experimentId>.json} document per experiment in a directory. Writes for the
 * same id are serialized in this process and replace the file atomically.
 */
public class FileSystemExperimentStore implements ExperimentStore {
  private static final Logger LOGGER = LoggerFactory.getLogger(FileSystemExperimentStore.class);
  private static final ObjectMapper OBJECT_MAPPER = ObjectMapperProvider.get();
  private static final String PATH_CONFIG = "path";
  private static final Pattern EXPERIMENT_ID = Pattern.compile("[A-Za-z0-9_.-]+");
  private static final int LOCK_STRIPES = 64;

  private final Path directory;
  private final Striped<Lock> locks = Striped.lock(LOCK_STRIPES);

  public FileSystemExperimentStore(Config fsConfig) {
    this(Paths.get(fsConfig.getString(PATH_CONFIG)));
  }

  public FileSystemExperimentStore(Path directory) {
    this.directory = directory;
  }

  @Override
  public Optional<ExperimentDocument> findById(String experimentId) throws IOException {
    Path file = fileOf(experimentId);
    if (!Files.exists(file)) {
      return Optional.empty();
    }
    return Optional.of(OBJECT_MAPPER.readValue(file.toFile(), ExperimentDocument.class));
  }

  /** Stores a document as given, overwriting any previous version. */
  public void save(ExperimentDocument experiment) throws IOException {
    Lock lock = locks.get(experiment.getId());
    lock.lock();
    try {
      write(experiment);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean updatePastNotifications(
      String experimentId, long expectedVersion, List<String> pastNotifications)
      throws IOException {
    Lock lock = locks.get(experimentId);
    lock.lock();
    try {
      Optional<ExperimentDocument> stored = findById(experimentId);
      if (stored.isEmpty()) {
        LOGGER.warn("Experiment {} not found, ledger not written", experimentId);
        return false;
      }
      if (stored.get().getVersion() != expectedVersion) {
        LOGGER.debug(
            "Experiment {} is at version {}, expected {}",
            experimentId,
            stored.get().getVersion(),
            expectedVersion);
        return false;
      }
      write(
          stored.get().toBuilder()
              .clearPastNotifications()
              .pastNotifications(pastNotifications)
              .version(expectedVersion + 1)
              .build());
      return true;
    } finally {
      lock.unlock();
    }
  }

  private void write(ExperimentDocument experiment) throws IOException {
    Files.createDirectories(directory);
    Path file = fileOf(experiment.getId());
    Path tmp = Files.createTempFile(directory, experiment.getId(), ".tmp");
    try {
      OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), experiment);
      Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } finally {
      Files.deleteIfExists(tmp);
    }
  }

  private Path fileOf(String experimentId) {
    Preconditions.checkArgument(
        experimentId != null && EXPERIMENT_ID.matcher(experimentId).matches(),
        "Invalid experiment id: %s",
        experimentId);
    return directory.resolve(experimentId + ".json");
  }
}
