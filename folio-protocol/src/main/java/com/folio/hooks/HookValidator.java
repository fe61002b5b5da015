package com.folio.hooks;

import com.folio.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Checks hook declarations against a {@link HookInterface}. Invalid hooks are logged and dropped,
 * never thrown: a misbehaving plugin must not block the whole build.
 */
public final class HookValidator {

    private static final Logger log = LoggerFactory.getLogger(HookValidator.class);

    private final HookInterface hookInterface;

    public HookValidator(HookInterface hookInterface) {
        this.hookInterface = Objects.requireNonNull(hookInterface, "hookInterface");
    }

    /** Lists every problem with the declaration; empty result means valid. */
    public ValidationResult check(HookDeclaration hook) {
        if (hook == null) {
            return ValidationResult.failure("hook is null");
        }
        List<String> errors = new ArrayList<>();
        HookPoint point = null;
        if (hook.getHook() == null || hook.getHook().isBlank()) {
            errors.add("'hook' is required");
        } else {
            point = hookInterface.get(hook.getHook());
            if (point == null) {
                errors.add("'" + hook.getHook() + "' is not a known hook point; known: "
                        + hookInterface.getPoints().stream().map(HookPoint::getName).toList());
            }
        }
        if (hook.getName() == null || hook.getName().isBlank()) {
            errors.add("'name' is required");
        }
        if (hook.getDescription() == null || hook.getDescription().isBlank()) {
            errors.add("'description' is required");
        }
        if (hook.getRun() == null) {
            errors.add("'run' is required");
        }
        if (hook.getPriority() < HookDeclaration.MIN_PRIORITY || hook.getPriority() > HookDeclaration.MAX_PRIORITY) {
            errors.add("'priority' must be between " + HookDeclaration.MIN_PRIORITY + " and "
                    + HookDeclaration.MAX_PRIORITY + ", got " + hook.getPriority());
        }
        if (point != null) {
            for (HookSlot slot : hook.getMutates()) {
                if (!point.isMutable(slot)) {
                    errors.add("declares it mutates '" + slot.slotName() + "', which is not mutable in '"
                            + point.getName() + "' (mutable: " + point.getMutable() + ")");
                }
            }
        }
        return ValidationResult.of(errors);
    }

    /**
     * Returns the hook if valid; otherwise logs a warning with every problem and returns empty.
     */
    public Optional<HookDeclaration> validate(HookDeclaration hook) {
        ValidationResult result = check(hook);
        if (result.isValid()) {
            return Optional.of(hook);
        }
        String name = hook != null ? hook.getName() : null;
        Provenance provenance = hook != null ? hook.getProvenance() : null;
        log.warn("Hook {} (added by {}) is invalid and will not run: {}", name, provenance, result);
        return Optional.empty();
    }

    /** Validates each hook, keeping valid ones in their original order. */
    public List<HookDeclaration> validateAll(List<HookDeclaration> hooks) {
        List<HookDeclaration> out = new ArrayList<>();
        if (hooks == null) return out;
        for (HookDeclaration h : hooks) {
            validate(h).ifPresent(out::add);
        }
        return out;
    }
}
