package ru.tigran.researchsignalengine.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import ru.tigran.researchsignalengine.dto.CodebookGroupInput;
import ru.tigran.researchsignalengine.dto.TagAssignmentInput;
import ru.tigran.researchsignalengine.dto.TagProposalInput;
import ru.tigran.researchsignalengine.dto.TaggedQuoteInput;
import ru.tigran.researchsignalengine.model.CellKey;
import ru.tigran.researchsignalengine.model.ProposalStatus;
import ru.tigran.researchsignalengine.model.QuoteContribution;
import ru.tigran.researchsignalengine.model.QuoteRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Turns tag associations into weighted quote contributions for tag analysis.
 *
 * Weighting rules:
 * - researcher-applied tag: 1.0
 * - accepted proposal: 1.0
 * - pending proposal: its confidence
 * - rejected proposal: not counted
 *
 * A (quote, tag) pair is counted once, with its highest weight, so an accepted tag
 * and its original proposal do not double-count. Per (quote, group) the weight is the
 * highest weight among the quote's tags in that group. A quote in several groups fans
 * out one contribution per group, for its section row and for its theme row.
 */
@Slf4j
@Component
public class TagContributionResolver {

    /**
     * Contributions and cell quote lookups for the section and theme matrices.
     */
    public record ResolvedContributions(
            List<QuoteContribution> sectionContributions,
            List<QuoteContribution> themeContributions,
            Map<CellKey, List<QuoteRecord>> sectionQuoteLookup,
            Map<CellKey, List<QuoteRecord>> themeQuoteLookup,
            int taggedQuoteCount
    ) {
        public boolean isEmpty() {
            return taggedQuoteCount == 0;
        }
    }

    /**
     * Resolves contributions for the given active groups.
     *
     * @param quotes all quotes of the study
     * @param activeGroups groups used as matrix columns, in display order
     * @param acceptedTags researcher-applied tags
     * @param proposedTags auto-coder proposals
     * @return contributions and quote lookups
     */
    public ResolvedContributions resolve(
            List<TaggedQuoteInput> quotes,
            List<CodebookGroupInput> activeGroups,
            List<TagAssignmentInput> acceptedTags,
            List<TagProposalInput> proposedTags
    ) {
        Map<Long, Map<String, Double>> tagWeights = collectTagWeights(acceptedTags, proposedTags);

        List<QuoteContribution> sectionContributions = new ArrayList<>();
        List<QuoteContribution> themeContributions = new ArrayList<>();
        Map<CellKey, List<QuoteRecord>> sectionLookup = new LinkedHashMap<>();
        Map<CellKey, List<QuoteRecord>> themeLookup = new LinkedHashMap<>();
        int taggedQuotes = 0;

        for (TaggedQuoteInput quote : quotes) {
            Map<String, Double> weights = tagWeights.get(quote.id());
            if (weights == null) {
                continue;
            }

            boolean tagged = false;
            for (CodebookGroupInput group : activeGroups) {
                GroupMembership membership = membership(group, weights);
                if (membership == null) {
                    continue;
                }
                tagged = true;
                QuoteRecord record = toRecord(quote, membership.tagNames());

                if (quote.sectionLabel() != null) {
                    QuoteContribution contribution = contribution(quote, quote.sectionLabel(), group.name(),
                            membership.weight());
                    sectionContributions.add(contribution);
                    sectionLookup.computeIfAbsent(contribution.cellKey(), k -> new ArrayList<>()).add(record);
                }
                if (quote.themeLabel() != null) {
                    QuoteContribution contribution = contribution(quote, quote.themeLabel(), group.name(),
                            membership.weight());
                    themeContributions.add(contribution);
                    themeLookup.computeIfAbsent(contribution.cellKey(), k -> new ArrayList<>()).add(record);
                }
            }
            if (tagged) {
                taggedQuotes++;
            }
        }

        log.debug("Resolved {} section and {} theme contributions from {} tagged quotes",
                sectionContributions.size(), themeContributions.size(), taggedQuotes);

        return new ResolvedContributions(
                sectionContributions,
                themeContributions,
                sectionLookup,
                themeLookup,
                taggedQuotes
        );
    }

    /**
     * quote ID -> (tag name -> highest qualifying weight)
     */
    private Map<Long, Map<String, Double>> collectTagWeights(
            List<TagAssignmentInput> acceptedTags,
            List<TagProposalInput> proposedTags
    ) {
        Map<Long, Map<String, Double>> weights = new LinkedHashMap<>();
        for (TagAssignmentInput tag : acceptedTags) {
            weights.computeIfAbsent(tag.quoteId(), k -> new LinkedHashMap<>())
                    .merge(tag.tagName(), QuoteContribution.FULL_WEIGHT, Math::max);
        }
        for (TagProposalInput proposal : proposedTags) {
            if (proposal.status() == ProposalStatus.REJECTED) {
                continue;
            }
            double weight = proposal.status() == ProposalStatus.ACCEPTED
                    ? QuoteContribution.FULL_WEIGHT
                    : proposal.confidence();
            weights.computeIfAbsent(proposal.quoteId(), k -> new LinkedHashMap<>())
                    .merge(proposal.tagName(), weight, Math::max);
        }
        return weights;
    }

    private record GroupMembership(double weight, List<String> tagNames) {
    }

    private GroupMembership membership(CodebookGroupInput group, Map<String, Double> quoteTagWeights) {
        double weight = 0.0;
        TreeSet<String> tagNames = new TreeSet<>();
        for (String tagName : group.tagNames()) {
            Double tagWeight = quoteTagWeights.get(tagName);
            if (tagWeight == null) {
                continue;
            }
            tagNames.add(tagName);
            weight = Math.max(weight, tagWeight);
        }
        return tagNames.isEmpty() ? null : new GroupMembership(weight, List.copyOf(tagNames));
    }

    private QuoteContribution contribution(TaggedQuoteInput quote, String row, String column, double weight) {
        return new QuoteContribution(row, column, quote.participantId(), quote.intensity(), weight);
    }

    private QuoteRecord toRecord(TaggedQuoteInput quote, List<String> tagNames) {
        return new QuoteRecord(
                quote.text(),
                quote.participantId(),
                quote.sessionId(),
                quote.startSeconds(),
                quote.intensity(),
                tagNames,
                quote.segmentIndex() != null ? quote.segmentIndex() : QuoteRecord.UNKNOWN_SEGMENT
        );
    }
}
