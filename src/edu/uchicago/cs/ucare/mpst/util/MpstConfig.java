package edu.uchicago.cs.ucare.mpst.util;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Analyzer settings read from mpst.conf. The copy on the classpath supplies defaults; a file
 * named by the {@code mpst.conf} system property overrides it.
 */
public class MpstConfig {

  protected final static Logger LOG = LoggerFactory.getLogger(MpstConfig.class);

  public static final String CONFIG_FILE = "mpst.conf";

  private final Properties conf;

  public MpstConfig() {
    this(new Properties());
  }

  public MpstConfig(Properties conf) {
    this.conf = conf;
  }

  public static MpstConfig load() throws IOException {
    Properties conf = new Properties();
    InputStream defaults = MpstConfig.class.getClassLoader().getResourceAsStream(CONFIG_FILE);
    if (defaults == null) {
      LOG.warn("No " + CONFIG_FILE + " on the classpath, using built-in defaults");
    } else {
      try {
        conf.load(defaults);
      } finally {
        defaults.close();
      }
    }
    String override = System.getProperty(CONFIG_FILE);
    if (override != null && !override.isEmpty()) {
      loadFile(conf, new File(override));
    }
    return new MpstConfig(conf);
  }

  public static MpstConfig load(File file) throws IOException {
    Properties conf = new Properties();
    loadFile(conf, file);
    return new MpstConfig(conf);
  }

  private static void loadFile(Properties conf, File file) throws IOException {
    FileInputStream fis = new FileInputStream(file);
    try {
      conf.load(fis);
    } finally {
      fis.close();
    }
    LOG.info("Loaded configuration from " + file.getPath());
  }

  public String getString(String key, String defaultValue) {
    return conf.getProperty(key, defaultValue).trim();
  }

  public int getInt(String key, int defaultValue) {
    String value = conf.getProperty(key);
    if (value == null || value.trim().isEmpty()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Configuration " + key + "=" + value
          + " is not a number", e);
    }
  }

  public long getLong(String key, long defaultValue) {
    String value = conf.getProperty(key);
    if (value == null || value.trim().isEmpty()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Configuration " + key + "=" + value
          + " is not a number", e);
    }
  }

  public boolean getBoolean(String key, boolean defaultValue) {
    String value = conf.getProperty(key);
    if (value == null || value.trim().isEmpty()) {
      return defaultValue;
    }
    return value.trim().equals("true");
  }

  public void set(String key, String value) {
    conf.setProperty(key, value);
  }

  public int getMaxSteps() {
    return getInt("max_steps", 1000);
  }

  public int getSafetyMaxStates() {
    return getInt("safety_max_states", 100000);
  }

  public int getProjectionMaxConfigurations() {
    return getInt("projection_max_configurations", 100000);
  }

  public String getSchedulingStrategy() {
    return getString("scheduling_strategy", "round-robin");
  }

  public String getChoiceStrategy() {
    return getString("choice_strategy", "first");
  }

  public long getRandomSeed() {
    return getLong("random_seed", 42L);
  }

  public int getHistoryMaxSnapshots() {
    return getInt("history_max_snapshots", 500);
  }

  public int getMaxCallDepth() {
    return getInt("max_call_depth", 100);
  }

  /** Whether verify_&lt;check&gt; is on; every check is on unless switched off. */
  public boolean isCheckEnabled(String check) {
    return getBoolean("verify_" + check, true);
  }

  public boolean isStrictMode() {
    return getBoolean("strict_mode", false);
  }

  /** Empty when no reports should be written. */
  public String getReportDir() {
    return getString("report_dir", "");
  }

  /** Library protocols to analyze; empty means all of them. */
  public List<String> getProtocols() {
    List<String> names = new ArrayList<String>();
    String value = getString("protocols", "all");
    if (value.isEmpty() || value.equals("all")) {
      return names;
    }
    for (String name : value.split(",")) {
      if (!name.trim().isEmpty()) {
        names.add(name.trim());
      }
    }
    return names;
  }

}
