package ru.tigran.researchsignalengine.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import ru.tigran.researchsignalengine.dto.CodebookGroupInput;
import ru.tigran.researchsignalengine.dto.TagAssignmentInput;
import ru.tigran.researchsignalengine.dto.TagProposalInput;
import ru.tigran.researchsignalengine.dto.TaggedQuoteInput;
import ru.tigran.researchsignalengine.model.CellKey;
import ru.tigran.researchsignalengine.model.ProposalStatus;
import ru.tigran.researchsignalengine.model.QuoteContribution;
import ru.tigran.researchsignalengine.model.QuoteRecord;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TagContributionResolver unit тесты")
class TagContributionResolverTest {

    private final TagContributionResolver resolver = new TagContributionResolver();

    private static final CodebookGroupInput USABILITY = new CodebookGroupInput("Usability", List.of("slow", "confusing"));
    private static final CodebookGroupInput TRUST = new CodebookGroupInput("Trust", List.of("security", "pricing"));

    private static TaggedQuoteInput quote(long id, String participant, String section, String theme) {
        return new TaggedQuoteInput(id, "quote " + id, participant, "s1", 1.0 * id, 2, (int) id, section, theme);
    }

    @Test
    @DisplayName("принятый тег и его предложение учитываются один раз с весом 1.0")
    void acceptedTagAndProposalCountOnce() {
        TagContributionResolver.ResolvedContributions resolved = resolver.resolve(
                List.of(quote(1, "p1", "Checkout", null)),
                List.of(USABILITY),
                List.of(new TagAssignmentInput(1L, "slow")),
                List.of(new TagProposalInput(1L, "slow", 0.6, ProposalStatus.PENDING))
        );

        assertEquals(1, resolved.sectionContributions().size());
        assertEquals(1.0, resolved.sectionContributions().get(0).weight());
        assertTrue(resolved.themeContributions().isEmpty());
        assertEquals(1, resolved.taggedQuoteCount());
    }

    @Test
    @DisplayName("вес предложения: pending = confidence, accepted = 1.0, rejected исключается")
    void proposalWeights() {
        TagContributionResolver.ResolvedContributions resolved = resolver.resolve(
                List.of(
                        quote(1, "p1", "Checkout", null),
                        quote(2, "p2", "Checkout", null),
                        quote(3, "p3", "Checkout", null)
                ),
                List.of(USABILITY),
                List.of(),
                List.of(
                        new TagProposalInput(1L, "slow", 0.6, ProposalStatus.PENDING),
                        new TagProposalInput(2L, "slow", 0.3, ProposalStatus.ACCEPTED),
                        new TagProposalInput(3L, "slow", 0.9, ProposalStatus.REJECTED)
                )
        );

        List<QuoteContribution> contributions = resolved.sectionContributions();
        assertEquals(2, contributions.size());
        assertEquals("p1", contributions.get(0).participantId());
        assertEquals(0.6, contributions.get(0).weight());
        assertEquals("p2", contributions.get(1).participantId());
        assertEquals(1.0, contributions.get(1).weight());
        assertEquals(2, resolved.taggedQuoteCount());
    }

    @Test
    @DisplayName("вес группы - максимум по тегам цитаты в этой группе")
    void groupWeightIsMaxOfTags() {
        TagContributionResolver.ResolvedContributions resolved = resolver.resolve(
                List.of(quote(1, "p1", "Checkout", null)),
                List.of(USABILITY),
                List.of(),
                List.of(
                        new TagProposalInput(1L, "slow", 0.4, ProposalStatus.PENDING),
                        new TagProposalInput(1L, "confusing", 0.7, ProposalStatus.PENDING)
                )
        );

        assertEquals(1, resolved.sectionContributions().size());
        assertEquals(0.7, resolved.sectionContributions().get(0).weight());
        QuoteRecord record = resolved.sectionQuoteLookup().get(CellKey.of("Checkout", "Usability")).get(0);
        assertEquals(List.of("confusing", "slow"), record.tagNames());
        assertEquals(1, record.segmentIndex());
    }

    @Test
    @DisplayName("цитата в двух группах даёт вклад в каждую группу для секции и темы")
    void fanOutAcrossGroupsAndViews() {
        TagContributionResolver.ResolvedContributions resolved = resolver.resolve(
                List.of(quote(1, "p1", "Checkout", "Payments")),
                List.of(USABILITY, TRUST),
                List.of(new TagAssignmentInput(1L, "slow"), new TagAssignmentInput(1L, "pricing")),
                List.of()
        );

        assertEquals(List.of("Usability", "Trust"),
                resolved.sectionContributions().stream().map(QuoteContribution::columnLabel).toList());
        assertEquals(List.of("Usability", "Trust"),
                resolved.themeContributions().stream().map(QuoteContribution::columnLabel).toList());
        assertTrue(resolved.themeContributions().stream().allMatch(c -> c.rowLabel().equals("Payments")));
        assertEquals(List.of("pricing"),
                resolved.themeQuoteLookup().get(CellKey.of("Payments", "Trust")).get(0).tagNames());
        assertEquals(1, resolved.taggedQuoteCount());
    }

    @Test
    @DisplayName("теги вне активных групп не учитываются")
    void tagsOutsideActiveGroupsIgnored() {
        TagContributionResolver.ResolvedContributions resolved = resolver.resolve(
                List.of(quote(1, "p1", "Checkout", null)),
                List.of(USABILITY),
                List.of(new TagAssignmentInput(1L, "security")),
                List.of()
        );

        assertTrue(resolved.isEmpty());
        assertTrue(resolved.sectionContributions().isEmpty());
    }

    @Test
    @DisplayName("цитата без секции и темы учитывается как тегированная, но без вкладов")
    void unplacedQuote() {
        TagContributionResolver.ResolvedContributions resolved = resolver.resolve(
                List.of(new TaggedQuoteInput(1L, "text", "p1", "s1", 0.0, 1, null, null, null)),
                List.of(USABILITY),
                List.of(new TagAssignmentInput(1L, "slow")),
                List.of()
        );

        assertEquals(1, resolved.taggedQuoteCount());
        assertTrue(resolved.sectionContributions().isEmpty());
        assertTrue(resolved.themeContributions().isEmpty());
    }
}
