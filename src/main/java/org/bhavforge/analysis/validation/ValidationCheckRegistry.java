package org.bhavforge.analysis.validation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.bhavforge.analysis.validation.checks.ControlFlowCheck;
import org.bhavforge.analysis.validation.checks.LogicCheck;
import org.bhavforge.analysis.validation.checks.StackBalanceCheck;
import org.bhavforge.analysis.validation.checks.TypeCheck;
import org.bhavforge.analysis.validation.checks.VariableScopeCheck;

/**
 * Ordered registry of validation checks, keyed by {@link IValidationCheck#name()}.
 * Registering a name twice replaces the earlier check in place.
 */
public final class ValidationCheckRegistry {

    private final Map<String, IValidationCheck> checks = new LinkedHashMap<>();

    public void register(IValidationCheck check) {
        checks.put(check.name(), check);
    }

    public boolean unregister(String name) {
        return checks.remove(name) != null;
    }

    /**
     * Resolves a check by name.
     *
     * @param name the check name
     * @return the check if registered
     */
    public Optional<IValidationCheck> resolve(String name) {
        return Optional.ofNullable(checks.get(name));
    }

    public List<IValidationCheck> checks() {
        return new ArrayList<>(checks.values());
    }

    /**
     * Creates a registry with the type, stack, variable, control-flow and logic checks.
     *
     * @return a fully initialized registry
     */
    public static ValidationCheckRegistry initializeWithDefaults() {
        ValidationCheckRegistry registry = new ValidationCheckRegistry();
        registry.register(new TypeCheck());
        registry.register(new StackBalanceCheck());
        registry.register(new VariableScopeCheck());
        registry.register(new ControlFlowCheck());
        registry.register(new LogicCheck());
        return registry;
    }
}
