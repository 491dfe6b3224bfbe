package org.tsticker;

public class BaseConfig {

    public static final String PROJECT_NAME = BaseConfig.class.getPackage().getImplementationTitle();
    public static final String PROJECT_VERSION = BaseConfig.class.getPackage().getImplementationVersion();

    private BaseConfig() {
    }
}
