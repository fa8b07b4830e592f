package com.example.rublimp.generator.phenomena;

import com.example.rublimp.generator.lexicon.LexicalResources;
import com.example.rublimp.generator.phenomena.agreement.AgreementPhenomena;
import com.example.rublimp.generator.phenomena.arguments.ArgumentStructurePhenomena;
import com.example.rublimp.generator.phenomena.aspect.AspectPhenomena;
import com.example.rublimp.generator.phenomena.government.GovernmentPhenomena;
import com.example.rublimp.generator.phenomena.inflection.InflectionPhenomena;
import com.example.rublimp.generator.phenomena.negation.NegationPhenomena;
import com.example.rublimp.generator.phenomena.reflexives.ReflexivePhenomena;
import com.example.rublimp.generator.phenomena.tense.TensePhenomena;
import com.example.rublimp.generator.phenomena.wordformation.WordFormationPhenomena;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The fixed table of phenomena, in registration order. Each id names exactly one matcher, rule and
 * check set.
 */
public final class PhenomenonRegistry {

    private final Map<String, Phenomenon> byId;

    private PhenomenonRegistry(Collection<Phenomenon> phenomena) {
        Map<String, Phenomenon> map = new LinkedHashMap<>();
        for (Phenomenon phenomenon : phenomena) {
            Phenomenon previous = map.put(phenomenon.id(), phenomenon);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate phenomenon id: " + phenomenon.id());
            }
        }
        this.byId = Collections.unmodifiableMap(map);
    }

    public static PhenomenonRegistry of(Collection<Phenomenon> phenomena) {
        return new PhenomenonRegistry(phenomena);
    }

    /**
     * All nine families over the given tables.
     */
    public static PhenomenonRegistry standard(LexicalResources resources) {
        Objects.requireNonNull(resources, "resources");
        List<Phenomenon> all = new ArrayList<>();
        all.addAll(AgreementPhenomena.create());
        all.addAll(GovernmentPhenomena.create(resources));
        all.addAll(WordFormationPhenomena.create(resources));
        all.addAll(InflectionPhenomena.create());
        all.addAll(AspectPhenomena.create(resources));
        all.addAll(TensePhenomena.create(resources));
        all.addAll(NegationPhenomena.create(resources));
        all.addAll(ReflexivePhenomena.create());
        all.addAll(ArgumentStructurePhenomena.create(resources));
        return new PhenomenonRegistry(all);
    }

    public List<Phenomenon> all() {
        return List.copyOf(byId.values());
    }

    public Optional<Phenomenon> find(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public Set<String> families() {
        Set<String> families = new LinkedHashSet<>();
        for (Phenomenon phenomenon : byId.values()) {
            families.add(phenomenon.family());
        }
        return families;
    }

    /**
     * Phenomena whose id or family is among {@code names}; an empty selection keeps everything.
     *
     * @throws IllegalArgumentException when a name is neither a known id nor a known family
     */
    public PhenomenonRegistry select(Collection<String> names) {
        if (names.isEmpty()) {
            return this;
        }
        Set<String> families = families();
        for (String name : names) {
            if (!byId.containsKey(name) && !families.contains(name)) {
                throw new IllegalArgumentException("Unknown phenomenon or family: " + name);
            }
        }
        List<Phenomenon> selected = new ArrayList<>();
        for (Phenomenon phenomenon : byId.values()) {
            if (names.contains(phenomenon.id()) || names.contains(phenomenon.family())) {
                selected.add(phenomenon);
            }
        }
        return new PhenomenonRegistry(selected);
    }

    public int size() {
        return byId.size();
    }
}
