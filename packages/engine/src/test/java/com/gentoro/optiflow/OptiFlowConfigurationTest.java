package com.gentoro.optiflow;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.gentoro.optiflow.exception.ConfigurationException;
import com.gentoro.optiflow.store.JsonFileStoreRepository;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class OptiFlowConfigurationTest {

  @TempDir Path dir;

  @Test
  @DisplayName("classpath defaults are used when no file is given")
  void classpathDefaults() {
    OptiFlowConfiguration configuration = new OptiFlowConfiguration((Path) null);

    assertFalse(configuration.keepStoreBackup());
    assertEquals(".bak", configuration.storeBackupSuffix());
    assertEquals("INFO", configuration.config().getString("logging.level.root"));
  }

  @Test
  @DisplayName("an explicit file configures store backups")
  void explicitFile() throws Exception {
    Path file = dir.resolve("optiflow.yaml");
    Files.writeString(
        file,
        """
        store:
          keep-backup: true
          backup-suffix: .prev
        """);

    OptiFlowConfiguration configuration = new OptiFlowConfiguration(file);
    JsonFileStoreRepository repository =
        (JsonFileStoreRepository) new OptiFlow(configuration).openStore(dir.resolve("s.json"));

    assertTrue(configuration.keepStoreBackup());
    assertEquals(dir.resolve("s.json.prev").toAbsolutePath().normalize(), repository.backupFile());
  }

  @Test
  @DisplayName("missing or malformed files are configuration errors")
  void invalidFiles() throws Exception {
    Path broken = dir.resolve("broken.yaml");
    Files.writeString(broken, "store: [unclosed");

    assertThrows(
        ConfigurationException.class, () -> new OptiFlowConfiguration(dir.resolve("none.yaml")));
    assertThrows(ConfigurationException.class, () -> new OptiFlowConfiguration(broken));
  }
}
