package scaraplate.context;

import scaraplate.config.ConfigurationException;

import java.util.function.Supplier;

public enum ContextType {
    SCARAPLATE_CONF("ScaraplateConf", () -> new IniContextReader(".scaraplate.conf", "cookiecutter_context")),
    SETUP_CFG("SetupCfg", () -> new IniContextReader("setup.cfg", "tool:cookiecutter_context")),
    YAML("Yaml", YamlContextReader::new);

    private static final String BUILT_IN_PREFIX = "scaraplate.cookiecutter.";

    private final String typeName;
    private final Supplier<ContextReader> reader;

    ContextType(String typeName, Supplier<ContextReader> reader) {
        this.typeName = typeName;
        this.reader = reader;
    }

    public ContextReader reader() {
        return reader.get();
    }

    public static ContextType byName(String name) {
        String shortName = name.startsWith(BUILT_IN_PREFIX) ? name.substring(BUILT_IN_PREFIX.length()) : name;
        for (ContextType type : values()) {
            if (type.typeName.equals(shortName)) {
                return type;
            }
        }
        throw new ConfigurationException("cookiecutter_context_type: unknown context type `" + name + "`");
    }
}
