/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.nosqlbench.drawtools.rename;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Mirrors class renames onto the prior-tracking twin columns.
///
/// ## Twin Naming
///
/// When prior draws are tracked, every parameter class `<class>` has twins
/// named `prior_<class>`. If the same class is reused across model
/// components, the backend appends `__<k>` to disambiguate:
///
/// ```text
///   prior_b            prior of all b coefficients
///   prior_sd_1__2      prior of the 2nd sd in block 1
///   prior_simo_1[3]    vector-valued prior
/// ```
///
/// ## Forms
///
/// - **Scalar form**: the class is replaced by the new class, then a
///   trailing `_<digits>` is replaced by the label that the `__<k>`
///   disambiguator points at. Columns whose name does not change are
///   skipped.
/// - **Vector form**: the class is replaced and, when labels are given,
///   the trailing `[<j>]` of the `i`-th matched column becomes `_<label_i>`.
///
/// Each call emits at most one [RenameOperation].
public final class PriorRenamer {

    private static final Logger logger = LogManager.getLogger(PriorRenamer.class);

    public static final String PRIOR_PREFIX = "prior_";

    private static final Pattern DISAMBIGUATOR = Pattern.compile("__(\\d+)$");
    private static final Pattern TRAILING_DIGITS = Pattern.compile("_\\d+$");
    private static final Pattern TRAILING_INDEX = Pattern.compile("\\[\\d+]$");

    private PriorRenamer() {
    }

    /// Scalar form keeping the class name.
    public static List<RenameOperation> scalar(List<String> names, String cls, List<String> labels) {
        return scalar(names, cls, cls, labels);
    }

    /// Scalar form.
    ///
    /// @param names the flat name table
    /// @param cls the backend class of the twins, without `prior_`
    /// @param newClass the class to substitute
    /// @param labels labels addressed by the `__<k>` disambiguator (1-based), or null
    /// @return zero or one operation
    public static List<RenameOperation> scalar(List<String> names, String cls, String newClass, List<String> labels) {
        BitSet matched = NamePattern.priorTwin(cls).mask(names);
        if (matched.isEmpty()) {
            return List.of();
        }
        BitSet changed = new BitSet(names.size());
        List<String> renamed = new ArrayList<>();
        for (int pos = matched.nextSetBit(0); pos >= 0; pos = matched.nextSetBit(pos + 1)) {
            String original = names.get(pos);
            String name = replaceClass(original, cls, newClass);
            int digit = disambiguator(name);
            if (digit > 0 && labels != null) {
                if (digit <= labels.size()) {
                    name = TRAILING_DIGITS.matcher(name).replaceFirst(Matcher.quoteReplacement(labels.get(digit - 1)));
                } else {
                    logger.debug("Prior column {} points at label {} of {}", original, digit, labels.size());
                }
            }
            if (!name.equals(original)) {
                changed.set(pos);
                renamed.add(name);
            }
        }
        return changed.isEmpty() ? List.of() : List.of(RenameOperation.of(changed, renamed));
    }

    /// Vector form.
    ///
    /// @param names the flat name table
    /// @param cls the backend class of the twins, without `prior_`
    /// @param newClass the class to substitute
    /// @param labels labels replacing the trailing element index, or null to keep it
    /// @return zero or one operation
    public static List<RenameOperation> vector(List<String> names, String cls, String newClass, List<String> labels) {
        BitSet matched = NamePattern.priorTwin(cls).mask(names);
        if (matched.isEmpty()) {
            return List.of();
        }
        List<String> renamed = new ArrayList<>();
        int i = 0;
        for (int pos = matched.nextSetBit(0); pos >= 0; pos = matched.nextSetBit(pos + 1), i++) {
            String name = replaceClass(names.get(pos), cls, newClass);
            if (labels != null && i < labels.size()) {
                name = TRAILING_INDEX.matcher(name).replaceFirst(Matcher.quoteReplacement("_" + labels.get(i)));
            }
            renamed.add(name);
        }
        return List.of(RenameOperation.of(matched, renamed));
    }

    private static String replaceClass(String name, String cls, String newClass) {
        return PRIOR_PREFIX + newClass + name.substring(PRIOR_PREFIX.length() + cls.length());
    }

    private static int disambiguator(String name) {
        Matcher m = DISAMBIGUATOR.matcher(name);
        return m.find() ? Integer.parseInt(m.group(1)) : 0;
    }
}
