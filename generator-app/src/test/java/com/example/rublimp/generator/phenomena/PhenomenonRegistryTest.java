package com.example.rublimp.generator.phenomena;

import com.example.rublimp.generator.TestFixtures;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class PhenomenonRegistryTest {

    private PhenomenonRegistry registry;

    @BeforeAll
    void setUp() {
        registry = PhenomenonRegistry.standard(TestFixtures.resources());
    }

    @Test
    void standardRegistryCoversNineFamilies() {
        Assertions.assertEquals(List.of("agreement", "government", "word_formation", "word_inflection", "aspect",
                "tense", "negation", "reflexives", "argument_structure"), List.copyOf(registry.families()));
        Assertions.assertTrue(registry.find("external_possessor").isPresent());
        Assertions.assertTrue(registry.find("negative_concord").isEmpty());
    }

    @Test
    void agreementFamilyCoversEverySubjectAndModifierKind() {
        List<String> agreement = registry.select(List.of("agreement")).all().stream()
                .map(Phenomenon::id).collect(Collectors.toList());

        Assertions.assertEquals(20, agreement.size());
        Assertions.assertTrue(agreement.containsAll(List.of("clause_subj_predicate_agreement_number",
                "genitive_subj_predicate_agreement_gender", "floating_quantifier_agreement_case",
                "np_agreement_gender_remote_modifier")));
        Assertions.assertEquals(40, registry.all().size());
    }

    @Test
    void selectsByIdAndByFamily() {
        PhenomenonRegistry selected = registry.select(List.of("tense", "deontic_imp"));

        List<String> ids = selected.all().stream().map(Phenomenon::id).collect(Collectors.toList());
        Assertions.assertEquals(List.of("deontic_imp", "verb_tense", "tense_marker"), ids,
                "Порядок регистрации сохраняется");
    }

    @Test
    void emptySelectionKeepsEverything() {
        Assertions.assertSame(registry, registry.select(List.of()));
    }

    @Test
    void unknownNameIsRejected() {
        IllegalArgumentException ex = Assertions.assertThrows(IllegalArgumentException.class,
                () -> registry.select(List.of("tense", "subjunctive")));
        Assertions.assertTrue(ex.getMessage().contains("subjunctive"));
    }

    @Test
    void duplicateIdsAreRejected() {
        Phenomenon first = stub("same");
        Phenomenon second = stub("same");

        Assertions.assertThrows(IllegalArgumentException.class, () -> PhenomenonRegistry.of(List.of(first, second)));
    }

    private static Phenomenon stub(String id) {
        return Phenomenon.builder(id, "test", FeatureAxis.NUMBER)
                .matcher(sentence -> Stream.empty())
                .rule(new PerturbationRule() {
                    @Override
                    public List<String> alternatives(Candidate candidate, PerturbationContext context) {
                        return List.of();
                    }

                    @Override
                    public Perturbation perturb(Candidate candidate, String value, PerturbationContext context)
                            throws UnsynthesizableException {
                        throw new UnsynthesizableException("unused");
                    }
                })
                .build();
    }
}
