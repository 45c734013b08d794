package edu.indiana.soic.spidal.configuration;

import edu.indiana.soic.spidal.configuration.section.SparseOpsSection;

public class ConfigurationMgr {
    private String configurationFilePath;
    public SparseOpsSection sparseOpsSection;

    public ConfigurationMgr(String configurationFilePath) {
        this.configurationFilePath = configurationFilePath;
        sparseOpsSection = new SparseOpsSection(configurationFilePath);
    }

    /**
     * @param configurationFilePath properties file, or <code>null</code> to
     *                              use defaults and system properties only
     */
    public static ConfigurationMgr LoadConfiguration(String configurationFilePath){
        return new ConfigurationMgr(configurationFilePath);
    }
}
