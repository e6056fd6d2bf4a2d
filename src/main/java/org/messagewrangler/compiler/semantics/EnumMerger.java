package org.messagewrangler.compiler.semantics;

import org.messagewrangler.compiler.api.ModelEntity;
import org.messagewrangler.compiler.api.ModelEnum;
import org.messagewrangler.compiler.api.ModelEnumValue;
import org.messagewrangler.compiler.api.TypeRef;
import org.messagewrangler.compiler.diagnostics.DiagnosticsEngine;
import org.messagewrangler.compiler.diagnostics.ErrorKind;
import org.messagewrangler.compiler.frontend.early.EarlyEnum;
import org.messagewrangler.compiler.frontend.early.EarlyEnumValue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolves the enums and options sets of one file into {@link ModelEnum}s.
 * <p>
 * An enum with a parent receives the parent's full value list first, each value tagged with the QFN of
 * the enum that originally declared it, followed by its own values. Parents are merged before their
 * children whatever the declaration order; an inheritance cycle is reported once and the enum closing
 * it is built without its parent.
 */
final class EnumMerger {

    private final DiagnosticsEngine diagnostics;
    private final Map<String, EarlyEnum> local;
    private final Map<String, ModelEntity> imported;
    private final Set<String> localSymbols;

    private final Map<String, ModelEnum> merged = new LinkedHashMap<>();
    private final LinkedHashSet<String> inProgress = new LinkedHashSet<>();

    /**
     * @param diagnostics  The diagnostics engine.
     * @param local        The file's enums by QFN, in declaration order.
     * @param imported     The entities declared by the file's direct imports.
     * @param localSymbols The QFNs of every entity declared in the file.
     */
    EnumMerger(DiagnosticsEngine diagnostics, Map<String, EarlyEnum> local,
               Map<String, ModelEntity> imported, Set<String> localSymbols) {
        this.diagnostics = diagnostics;
        this.local = local;
        this.imported = imported;
        this.localSymbols = localSymbols;
    }

    /**
     * Merges every local enum.
     *
     * @return The resolved enums by QFN, in declaration order.
     */
    Map<String, ModelEnum> mergeAll() {
        for (String qfn : local.keySet()) {
            resolve(qfn);
        }
        Map<String, ModelEnum> ordered = new LinkedHashMap<>();
        for (String qfn : local.keySet()) {
            ordered.put(qfn, merged.get(qfn));
        }
        return ordered;
    }

    private ModelEnum resolve(String qfn) {
        ModelEnum done = merged.get(qfn);
        if (done != null) {
            return done;
        }
        EarlyEnum early = local.get(qfn);
        if (early == null) {
            return imported.get(qfn) instanceof ModelEnum e ? e : null;
        }

        inProgress.add(qfn);
        List<ModelEnumValue> values = new ArrayList<>();
        TypeRef parentRef = null;
        String parentQfn = early.parentRaw();
        if (parentQfn != null) {
            if (inProgress.contains(parentQfn)) {
                reportCycle(parentQfn, early);
            } else {
                ModelEnum parent = resolve(parentQfn);
                if (parent == null || parent.options()) {
                    reportBadParent(qfn, early, parentQfn);
                } else {
                    parentRef = parent.ref();
                    for (ModelEnumValue v : parent.values()) {
                        values.add(new ModelEnumValue(v.name(), v.value(), v.doc(), v.comment(), v.source(),
                                v.isInherited() ? v.inheritedFrom() : parent.qfn()));
                    }
                }
            }
        }
        addOwnValues(qfn, early, values);

        List<Long> numbers = new ArrayList<>(values.size());
        for (ModelEnumValue v : values) {
            numbers.add(v.value());
        }
        ModelEnum result = new ModelEnum(early.name(), qfn, early.isOptions(), early.isOpen(),
                BitWidthCalculator.widthFor(numbers, early.isOpen()), values, parentRef,
                nullToEmpty(early.doc()), nullToEmpty(early.comment()), early.source(), early.promotedFrom());
        inProgress.remove(qfn);
        merged.put(qfn, result);
        return result;
    }

    private void addOwnValues(String qfn, EarlyEnum early, List<ModelEnumValue> values) {
        Map<String, String> inheritedFrom = new HashMap<>();
        Map<Long, String> byNumber = new HashMap<>();
        for (ModelEnumValue v : values) {
            inheritedFrom.put(v.name(), v.inheritedFrom());
            byNumber.putIfAbsent(v.value(), v.name());
        }
        Set<String> own = new HashSet<>();
        String kind = early.isOptions() ? "Options" : "Enum";
        for (EarlyEnumValue v : early.values()) {
            int line = v.source() != null ? v.source().line() : early.source().line();
            if (inheritedFrom.containsKey(v.name())) {
                diagnostics.reportError(ErrorKind.DUPLICATE_ENUM_VALUE,
                        kind + " '" + qfn + "' redeclares value '" + v.name() + "' inherited from '"
                                + inheritedFrom.get(v.name()) + "'.",
                        early.source().file(), line);
                continue;
            }
            if (!own.add(v.name())) {
                diagnostics.reportError(ErrorKind.DUPLICATE_ENUM_VALUE,
                        kind + " '" + qfn + "' declares value '" + v.name() + "' more than once.",
                        early.source().file(), line);
                continue;
            }
            String previous = byNumber.putIfAbsent(v.value(), v.name());
            if (previous != null) {
                diagnostics.reportWarning(kind + " '" + qfn + "': value '" + v.name() + "' reuses number "
                        + v.value() + " of '" + previous + "'.", early.source().file(), line);
            }
            values.add(new ModelEnumValue(v.name(), v.value(), nullToEmpty(v.doc()), nullToEmpty(v.comment()),
                    v.source(), null));
        }
    }

    private void reportCycle(String parentQfn, EarlyEnum early) {
        List<String> chain = new ArrayList<>();
        boolean inCycle = false;
        for (String member : inProgress) {
            inCycle |= member.equals(parentQfn);
            if (inCycle) {
                chain.add(member);
            }
        }
        chain.add(parentQfn);
        diagnostics.reportError(ErrorKind.CIRCULAR_INHERITANCE,
                "Circular enum inheritance: " + String.join(" -> ", chain),
                early.source().file(), early.source().line());
    }

    private void reportBadParent(String qfn, EarlyEnum early, String parentQfn) {
        boolean exists = localSymbols.contains(parentQfn) || imported.containsKey(parentQfn);
        String message = exists
                ? "Enum '" + qfn + "' cannot extend '" + parentQfn + "': it is not an enum."
                : "Enum '" + qfn + "' extends unknown enum '" + parentQfn + "'.";
        diagnostics.reportError(ErrorKind.UNRESOLVED_REFERENCE, message, early.source().file(), early.source().line());
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
