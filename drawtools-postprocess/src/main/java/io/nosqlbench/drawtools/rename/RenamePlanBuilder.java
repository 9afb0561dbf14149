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

import io.nosqlbench.drawtools.model.Autocorrelation;
import io.nosqlbench.drawtools.model.CategorySpecificEffects;
import io.nosqlbench.drawtools.model.FamilyCorrelation;
import io.nosqlbench.drawtools.model.FixedEffects;
import io.nosqlbench.drawtools.model.GaussianProcesses;
import io.nosqlbench.drawtools.model.GroupLevelEffects;
import io.nosqlbench.drawtools.model.HazardBaseline;
import io.nosqlbench.drawtools.model.MeasurementError;
import io.nosqlbench.drawtools.model.MissingValues;
import io.nosqlbench.drawtools.model.ModelDescription;
import io.nosqlbench.drawtools.model.NamePrefix;
import io.nosqlbench.drawtools.model.PredictorNode;
import io.nosqlbench.drawtools.model.ResidualCorrelation;
import io.nosqlbench.drawtools.model.ResponseNode;
import io.nosqlbench.drawtools.model.Smooths;
import io.nosqlbench.drawtools.model.SpecialEffects;
import io.nosqlbench.drawtools.model.TermGroup;
import io.nosqlbench.drawtools.model.Thresholds;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static io.nosqlbench.drawtools.model.NamePrefix.underscored;
import static io.nosqlbench.drawtools.rename.ParameterLabels.correlationNames;
import static io.nosqlbench.drawtools.rename.ParameterLabels.indexed;
import static io.nosqlbench.drawtools.rename.ParameterLabels.sequence;
import static io.nosqlbench.drawtools.rename.ParameterLabels.suffixed;

/// Builds the [RenamePlan] that turns backend flat names into labelled names.
///
/// ## Purpose
///
/// The backend's code generator has no notion of coefficient, group or
/// level labels, so its columns are positional: `b[2]`, `sd_1[1]`,
/// `r_1_1[3]`. This builder walks a [ModelDescription] and, for every term
/// group, emits the operations that relabel the matching columns:
///
/// ```text
///   b[1], b[2]            → b_Intercept, b_x1
///   sd_1[1]               → sd_site__Intercept
///   r_1_1[1..3]           → r_site[A,Intercept], r_site[B,Intercept], r_site[C,Intercept]
///   prior_sd_1            → prior_sd_site
/// ```
///
/// ## Traversal
///
/// All term groups of the tree are collected with their owning response
/// and predictor, then visited in [io.nosqlbench.drawtools.model.TermKind]
/// declaration order (a stable sort, so tree order is kept within a kind).
/// Each group is dispatched through a `switch` on its kind.
///
/// ## Guarantees
///
/// - the builder never touches a sample store; it only reads the name table
/// - all masks are computed on the name table passed in, never on partially
///   renamed names
/// - a term group without matching columns yields operations with empty
///   masks, which the executor treats as no-ops
public final class RenamePlanBuilder {

    private static final Logger logger = LogManager.getLogger(RenamePlanBuilder.class);

    public static final String DEFAULT_FILLER = ".";

    private final String filler;

    public RenamePlanBuilder() {
        this(DEFAULT_FILLER);
    }

    /// @param filler replacement for whitespace inside level labels
    public RenamePlanBuilder(String filler) {
        this.filler = Objects.requireNonNull(filler, "filler cannot be null");
    }

    /// Where a term group hangs in the description tree.
    ///
    /// @param response response label
    /// @param prefix combined name prefix of the owner (empty for model scope)
    private record Owner(String response, String prefix) {
        static final Owner MODEL = new Owner("", "");
    }

    private record Located(Owner owner, TermGroup group) {
    }

    /// Builds the plan for a name table.
    ///
    /// @param description the structural model description
    /// @param names the backend flat name table
    /// @return the ordered operations
    public RenamePlan build(ModelDescription description, List<String> names) {
        Objects.requireNonNull(description, "description cannot be null");
        Objects.requireNonNull(names, "names cannot be null");

        List<Located> located = new ArrayList<>();
        for (ResponseNode response : description.responses()) {
            for (PredictorNode predictor : response.predictors()) {
                Owner owner = new Owner(response.response(),
                    NamePrefix.combine(response.response(), predictor.dpar(), predictor.nlpar()));
                predictor.terms().forEach(group -> located.add(new Located(owner, group)));
            }
            Owner owner = new Owner(response.response(), response.prefix());
            response.terms().forEach(group -> located.add(new Located(owner, group)));
        }
        description.terms().forEach(group -> located.add(new Located(Owner.MODEL, group)));
        located.sort(Comparator.comparingInt(l -> l.group().kind().ordinal()));

        RenamePlan.Builder plan = RenamePlan.builder();
        for (Located l : located) {
            plan.addAll(rules(l.owner(), l.group(), names));
        }
        RenamePlan built = plan.build();
        logger.debug("Built rename plan with {} operations ({} effective) for {} columns",
            built.size(), built.effective().size(), names.size());
        return built;
    }

    private List<RenameOperation> rules(Owner owner, TermGroup group, List<String> names) {
        return switch (group.kind()) {
            case FIXED -> fixedEffects(owner.prefix(), (FixedEffects) group, names);
            case SPECIAL -> specialEffects(owner.prefix(), (SpecialEffects) group, names);
            case CATEGORY_SPECIFIC -> categorySpecific(owner.prefix(), (CategorySpecificEffects) group, names);
            case SMOOTH -> smooths(owner.prefix(), (Smooths) group, names);
            case GAUSSIAN_PROCESS -> gaussianProcesses(owner.prefix(), (GaussianProcesses) group, names);
            case AUTOCORRELATION -> autocorrelation(owner.response(), (Autocorrelation) group, names);
            case GROUP_LEVEL -> groupLevel((GroupLevelEffects) group, names);
            case THRESHOLDS -> thresholds(owner.prefix(), (Thresholds) group, names);
            case HAZARD_BASELINE -> hazardBaseline(owner.prefix(), (HazardBaseline) group, names);
            case MEASUREMENT_ERROR -> measurementError((MeasurementError) group, names);
            case MISSING_VALUES -> missingValues(owner.prefix(), (MissingValues) group, names);
            case FAMILY_CORRELATION -> familyCorrelation((FamilyCorrelation) group, names);
            case RESIDUAL_CORRELATION -> residualCorrelation((ResidualCorrelation) group, names);
        };
    }

    List<RenameOperation> fixedEffects(String prefix, FixedEffects fixed, List<String> names) {
        List<String> coefficients = fixed.coefficients();
        if (coefficients.isEmpty()) {
            return List.of();
        }
        List<RenameOperation> out = new ArrayList<>();
        String b = "b" + underscored(prefix);
        out.add(renameComponent(b, suffixed(b, coefficients), names));
        out.addAll(PriorRenamer.scalar(names, b, coefficients));
        if (fixed.specialPrior()) {
            String sdb = "sdb" + underscored(prefix);
            out.add(renameComponent(sdb, suffixed(sdb, coefficients), names));
        }
        return out;
    }

    List<RenameOperation> specialEffects(String prefix, SpecialEffects special, List<String> names) {
        if (special.effects().isEmpty()) {
            return List.of();
        }
        List<RenameOperation> out = new ArrayList<>();
        List<String> coefficients = special.coefficients();
        String bsp = "bsp" + underscored(prefix);
        out.add(renameComponent(bsp, suffixed(bsp, coefficients), names));
        out.addAll(PriorRenamer.scalar(names, bsp, coefficients));

        List<String> simplexLabels = special.simplexLabels();
        String simo = "simo" + underscored(prefix);
        for (int i = 0; i < simplexLabels.size(); i++) {
            String simoOld = simo + "_" + (i + 1);
            String simoNew = simo + "_" + simplexLabels.get(i);
            BitSet mask = NamePattern.indexed(simoOld).mask(names);
            out.add(RenameOperation.of(mask, indexed(simoNew, sequence(mask.cardinality()))));
            out.addAll(PriorRenamer.vector(names, simoOld, simoNew, null));
        }
        if (special.specialPrior()) {
            String sdbsp = "sdbsp" + underscored(prefix);
            out.add(renameComponent(sdbsp, suffixed(sdbsp, coefficients), names));
        }
        return out;
    }

    /// Category-specific effects arrive threshold-major and are relabeled
    /// coefficient-major, so their values are permuted as well.
    List<RenameOperation> categorySpecific(String prefix, CategorySpecificEffects cs, List<String> names) {
        List<String> coefficients = cs.coefficients();
        if (coefficients.isEmpty()) {
            return List.of();
        }
        int thresholds = cs.thresholds() > 0
            ? cs.thresholds()
            : NamePattern.indexed("b" + underscored(prefix) + "_Intercept").count(names);
        if (thresholds == 0) {
            logger.debug("No thresholds found for category-specific effects {}", coefficients);
            return List.of();
        }
        String bcs = "bcs" + underscored(prefix);
        int ncs = coefficients.size();
        List<String> newNames = new ArrayList<>(ncs * thresholds);
        int[] sort = new int[ncs * thresholds];
        int k = 0;
        for (int i = 0; i < ncs; i++) {
            for (int t = 0; t < thresholds; t++) {
                newNames.add(bcs + "_" + coefficients.get(i) + "[" + (t + 1) + "]");
                sort[k++] = i + t * ncs;
            }
        }
        List<RenameOperation> out = new ArrayList<>();
        out.add(RenameOperation.sorted(NamePattern.disambiguated(bcs).mask(names), newNames, sort));
        out.addAll(PriorRenamer.scalar(names, bcs, coefficients));
        return out;
    }

    List<RenameOperation> smooths(String prefix, Smooths smooths, List<String> names) {
        if (smooths.isEmpty()) {
            return List.of();
        }
        List<RenameOperation> out = new ArrayList<>();
        List<String> linear = smooths.linearNames();
        if (!linear.isEmpty()) {
            String bs = "bs" + underscored(prefix);
            out.add(renameComponent(bs, suffixed(bs, linear), names));
            out.addAll(PriorRenamer.scalar(names, bs, linear));
        }
        if (smooths.specialPrior()) {
            String sdbs = "sdbs" + underscored(prefix);
            out.add(renameComponent(sdbs, suffixed(sdbs, linear), names));
        }

        String sds = "sds" + underscored(prefix);
        String s = "s" + underscored(prefix);
        List<Smooths.Term> terms = smooths.terms();
        for (int i = 0; i < terms.size(); i++) {
            Smooths.Term term = terms.get(i);
            String sdsOld = sds + "_" + (i + 1);
            String sdsNew = sds + "_" + term.label();
            BitSet sdsMask = NamePattern.scalarOrIndexed(sdsOld).mask(names);
            out.add(RenameOperation.of(sdsMask, suffixed(sdsNew, sequence(term.bases()))));
            out.addAll(PriorRenamer.scalar(names, sdsOld, sdsNew, null));
            for (int j = 1; j <= term.bases(); j++) {
                BitSet sMask = NamePattern.scalarOrIndexed(s + "_" + (i + 1) + "_" + j).mask(names);
                String sNew = s + "_" + term.label() + "_" + j;
                out.add(RenameOperation.of(sMask, indexed(sNew, sequence(sMask.cardinality()))));
            }
        }
        return out;
    }

    List<RenameOperation> gaussianProcesses(String prefix, GaussianProcesses gps, List<String> names) {
        List<RenameOperation> out = new ArrayList<>();
        String sdgp = "sdgp" + underscored(prefix);
        String lscale = "lscale" + underscored(prefix);
        String zgp = "zgp" + underscored(prefix);
        List<GaussianProcesses.Term> terms = gps.terms();
        for (int i = 0; i < terms.size(); i++) {
            GaussianProcesses.Term term = terms.get(i);
            List<String> scaleLabels = term.scaleLabels();

            String sdgpOld = sdgp + "_" + (i + 1);
            out.add(renameIndexed(sdgpOld, suffixed(sdgp, scaleLabels), names));
            out.addAll(PriorRenamer.scalar(names, sdgpOld, sdgp, scaleLabels));

            String lscaleOld = lscale + "_" + (i + 1);
            out.add(renameIndexed(lscaleOld, suffixed(lscale, term.lengthScaleLabels()), names));
            out.addAll(PriorRenamer.scalar(names, lscaleOld, lscale, term.lengthScaleLabels()));

            String zgpOld = zgp + "_" + (i + 1);
            if (term.hasByLevels()) {
                for (int j = 0; j < scaleLabels.size(); j++) {
                    BitSet mask = NamePattern.indexed(zgpOld + "_" + (j + 1)).mask(names);
                    if (!mask.isEmpty()) {
                        String zgpNew = zgp + "_" + scaleLabels.get(j);
                        out.add(RenameOperation.of(mask, indexed(zgpNew, sequence(mask.cardinality()))));
                    }
                }
            } else if (!scaleLabels.isEmpty()) {
                BitSet mask = NamePattern.indexed(zgpOld).mask(names);
                if (!mask.isEmpty()) {
                    String zgpNew = zgp + "_" + scaleLabels.get(0);
                    out.add(RenameOperation.of(mask, indexed(zgpNew, sequence(mask.cardinality()))));
                }
            }
        }
        return out;
    }

    List<RenameOperation> autocorrelation(String response, Autocorrelation ac, List<String> names) {
        if (!ac.isUnstructured()) {
            return List.of();
        }
        String cortime = "cortime" + underscored(response);
        return List.of(renameIndexed(cortime, correlationNames(ac.unstructuredTimes(), cortime), names));
    }

    List<RenameOperation> groupLevel(GroupLevelEffects re, List<String> names) {
        if (re.terms().isEmpty()) {
            return List.of();
        }
        List<RenameOperation> out = new ArrayList<>();
        for (Map.Entry<Integer, List<GroupLevelEffects.Term>> block : re.blocks().entrySet()) {
            int id = block.getKey();
            List<GroupLevelEffects.Term> rows = block.getValue();
            GroupLevelEffects.Term first = rows.get(0);
            String group = first.group();
            List<List<String>> columns = groupLevelNames(rows);
            List<String> flat = columns.stream().flatMap(List::stream).toList();

            String sdOld = "sd_" + id;
            List<String> sdNames = flat.stream()
                .map(name -> "sd_" + group + ParameterLabels.SEPARATOR + name).toList();
            out.add(RenameOperation.of(NamePattern.scalarOrIndexed(sdOld).mask(names), sdNames));
            out.addAll(PriorRenamer.scalar(names, sdOld, "sd_" + group,
                flat.stream().map(name -> "_" + name).toList()));

            if (rows.size() > 1 && first.correlated()) {
                String type = "cor_" + group;
                List<String> corNames = new ArrayList<>();
                for (List<String> column : columns) {
                    corNames.addAll(correlationNames(column, type));
                }
                String corOld = "cor_" + id;
                out.add(RenameOperation.of(NamePattern.disambiguated(corOld).mask(names), corNames));
                out.addAll(PriorRenamer.scalar(names, corOld, type, null));
            }
        }
        if (names.stream().anyMatch(name -> name.startsWith("r_"))) {
            out.addAll(groupLevelDraws(re, names));
        }

        Set<Integer> studentGroups = new LinkedHashSet<>();
        for (GroupLevelEffects.Term term : re.terms()) {
            if (term.isStudent() && studentGroups.add(term.groupIndex())) {
                out.add(RenameOperation.of(NamePattern.exact("df_" + term.groupIndex()).mask(names),
                    List.of("df_" + term.group())));
            }
        }
        return out;
    }

    /// Coefficient names of one block, one list per level of the nesting
    /// variable (a single list when not nested). Coefficients of a non-main
    /// predictor carry its prefix, e.g. `sigma_Intercept`.
    private static List<List<String>> groupLevelNames(List<GroupLevelEffects.Term> rows) {
        List<String> base = rows.stream().map(term -> {
            String prefix = term.prefix();
            return (prefix.isEmpty() ? "" : prefix + "_") + term.coefficient();
        }).toList();
        GroupLevelEffects.Term first = rows.get(0);
        if (!first.isNested()) {
            return List.of(base);
        }
        List<List<String>> columns = new ArrayList<>();
        for (String level : first.byLevels()) {
            columns.add(base.stream().map(name -> name + ":" + first.by() + level).toList());
        }
        return columns;
    }

    private List<RenameOperation> groupLevelDraws(GroupLevelEffects re, List<String> names) {
        List<RenameOperation> out = new ArrayList<>();
        for (GroupLevelEffects.Term term : re.terms()) {
            String prefix = underscored(term.prefix());
            BitSet mask = NamePattern.scalarOrIndexed(
                "r_" + term.id() + prefix + "_" + term.coefficientIndex()).mask(names);
            String newName = "r_" + term.group() + underscored(prefix);
            List<String> levels = re.levels().get(term.group());
            if (levels == null) {
                logger.warn("No levels known for grouping factor '{}', using positional indices", term.group());
                levels = sequence(mask.cardinality());
            }
            out.add(RenameOperation.of(mask, ParameterLabels.crossIndexed(newName,
                ParameterLabels.sanitize(levels, filler), List.of(term.coefficient()))));
        }
        return out;
    }

    List<RenameOperation> thresholds(String prefix, Thresholds thresholds, List<String> names) {
        if (!thresholds.isGrouped()) {
            return List.of();
        }
        List<RenameOperation> out = new ArrayList<>();
        String intercept = "b" + underscored(prefix) + "_Intercept";
        List<Thresholds.Group> groups = thresholds.groups();
        for (int i = 0; i < groups.size(); i++) {
            Thresholds.Group group = groups.get(i);
            BitSet mask = NamePattern.indexed(intercept + "_" + (i + 1)).mask(names);
            List<String> labels = group.thresholds().isEmpty()
                ? sequence(mask.cardinality()) : group.thresholds();
            List<String> newNames = labels.stream()
                .map(label -> intercept + "[" + group.name() + "," + label + "]").toList();
            out.add(RenameOperation.of(mask, newNames));
        }
        return out;
    }

    List<RenameOperation> hazardBaseline(String prefix, HazardBaseline hazard, List<String> names) {
        if (!hazard.isGrouped()) {
            return List.of();
        }
        List<RenameOperation> out = new ArrayList<>();
        String sbhaz = "sbhaz" + underscored(prefix);
        List<String> groups = hazard.groups();
        for (int k = 0; k < groups.size(); k++) {
            String group = groups.get(k);
            BitSet mask = NamePattern.firstIndex(sbhaz, k + 1).mask(names);
            List<String> newNames = sequence(mask.cardinality()).stream()
                .map(f -> sbhaz + "[" + group + "," + f + "]").toList();
            out.add(RenameOperation.of(mask, newNames));
        }
        return out;
    }

    List<RenameOperation> measurementError(MeasurementError me, List<String> names) {
        List<RenameOperation> out = new ArrayList<>();
        boolean hasLatent = names.stream().anyMatch(name -> name.startsWith("Xme_"));
        int i = 0;
        for (Map.Entry<String, List<Integer>> entry : me.groups().entrySet()) {
            i++;
            String group = entry.getKey();
            List<Integer> members = entry.getValue();
            List<String> coefficients = members.stream()
                .map(k -> me.terms().get(k - 1).coefficient()).toList();

            for (String par : List.of("meanme", "sdme")) {
                String hpar = par + "_" + i;
                out.add(renameIndexed(hpar, suffixed(par, coefficients), names));
                out.addAll(PriorRenamer.scalar(names, hpar, par, coefficients));
            }

            if (hasLatent) {
                for (int k : members) {
                    BitSet mask = NamePattern.indexed("Xme_" + k).mask(names);
                    String newName = "Xme_" + me.terms().get(k - 1).coefficient();
                    List<String> levels = group.isEmpty() ? null : me.levels().get(group);
                    List<String> indices = levels == null
                        ? sequence(mask.cardinality())
                        : ParameterLabels.sanitize(levels, filler);
                    out.add(RenameOperation.of(mask, indexed(newName, indices)));
                }
            }

            if (me.terms().get(members.get(0) - 1).correlated() && members.size() > 1) {
                String type = "corme" + underscored(group);
                String cormeOld = "corme_" + i;
                out.add(RenameOperation.of(NamePattern.scalarOrIndexed(cormeOld).mask(names),
                    correlationNames(coefficients, type)));
                out.addAll(PriorRenamer.scalar(names, cormeOld, type, null));
            }
        }
        return out;
    }

    List<RenameOperation> missingValues(String prefix, MissingValues missing, List<String> names) {
        String ymi = "Ymi" + underscored(prefix);
        BitSet mask = NamePattern.indexed(ymi).mask(names);
        if (mask.isEmpty()) {
            return List.of();
        }
        List<String> rows = missing.rows().stream().map(String::valueOf).toList();
        return List.of(RenameOperation.of(mask, indexed(ymi, rows)));
    }

    List<RenameOperation> familyCorrelation(FamilyCorrelation family, List<String> names) {
        return List.of(renameIndexed("lncor", correlationNames(family.categories(), "lncor"), names));
    }

    List<RenameOperation> residualCorrelation(ResidualCorrelation residual, List<String> names) {
        return List.of(renameIndexed("rescor", correlationNames(residual.responses(), "rescor"), names));
    }

    /// Coefficient vectors may carry the component index of the code
    /// generator, so both `b[j]` and `b_1[j]` select the same class.
    private static RenameOperation renameComponent(String cls, List<String> newNames, List<String> names) {
        return RenameOperation.of(NamePattern.disambiguated(cls).mask(names), newNames);
    }

    private static RenameOperation renameIndexed(String cls, List<String> newNames, List<String> names) {
        return RenameOperation.of(NamePattern.indexed(cls).mask(names), newNames);
    }
}
