package com.codeprint.runtime;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.codeprint.code.ImportFailureException;
import com.codeprint.code.ModuleResolver;

/**
 * Default module resolver. Registered modules win; any other name is tried as a
 * fully-qualified Java class, which then plays the role of the module.
 */
public final class ModuleRegistry implements ModuleResolver {
    private final Map<String, Object> modules = new LinkedHashMap<>();
    private final ClassLoader classLoader;

    public ModuleRegistry() {
        this(ModuleRegistry.class.getClassLoader());
    }

    public ModuleRegistry(ClassLoader classLoader) {
        this.classLoader = classLoader;
    }

    public synchronized ModuleRegistry register(ScriptModule module) {
        modules.put(module.name, module);
        return this;
    }

    public synchronized ModuleRegistry register(String name, Object module) {
        modules.put(Objects.requireNonNull(name, "name"), module);
        return this;
    }

    public synchronized boolean isRegistered(String name) {
        return modules.containsKey(name);
    }

    @Override
    public Object resolve(String moduleName) {
        if (moduleName == null || moduleName.isEmpty()) {
            throw new ImportFailureException(String.valueOf(moduleName), "empty module name");
        }
        synchronized (this) {
            if (modules.containsKey(moduleName)) return modules.get(moduleName);
        }
        try {
            // no static initialisers: resolving must not run user code
            return Class.forName(moduleName, false, classLoader);
        } catch (ClassNotFoundException | LinkageError e) {
            throw new ImportFailureException(moduleName, "No module named '" + moduleName + "'", e);
        }
    }
}
