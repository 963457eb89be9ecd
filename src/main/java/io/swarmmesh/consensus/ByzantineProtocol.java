package io.swarmmesh.consensus;

import io.swarmmesh.model.ConsensusAlgorithm;
import io.swarmmesh.model.ProposalOutcome;
import io.swarmmesh.model.Vote;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Byzantine fault tolerant ballot over {@code n} participants tolerating {@code f = floor((n - 1) / 3)}
 * faulty ones.
 *
 * <p>After the vote round every responder reports what it saw the others vote. An agent is flagged as
 * faulty when it disowns its own announced vote, or when it misreports another agent against the majority
 * of reports about that agent. Flagged agents are left out, and the proposal is approved when at least
 * {@code 2f + 1} of the remaining agents voted YES. With {@code n <= 3} the fault bound is zero and the
 * ballot is tallied as a plain quorum.
 */
public final class ByzantineProtocol implements ConsensusProtocol {
    @Override
    public ConsensusAlgorithm algorithm() {
        return ConsensusAlgorithm.BYZANTINE;
    }

    @Override
    public ConsensusDecision decide(VotingContext context) throws InterruptedException {
        int n = context.voters().size();
        Map<String, Vote> announced = context.collector().collectVotes(context.proposal(), context.voters());
        if (announced.isEmpty()) {
            return ConsensusDecision.timeout(n, "no votes before deadline");
        }
        if (n <= 3) {
            return QuorumProtocol.tally(announced, n, context.settings().quorumThreshold())
                    .withDetail("fallback", ConsensusAlgorithm.QUORUM.wireName());
        }
        List<Voter> responders = new ArrayList<>();
        for (Voter v : context.voters()) {
            if (announced.containsKey(v.agentId())) {
                responders.add(v);
            }
        }
        Map<String, Map<String, Vote>> reports =
                context.collector().collectPeerReports(context.proposal(), responders, announced);
        return tally(announced, reports, n);
    }

    public static ConsensusDecision tally(Map<String, Vote> announced, Map<String, Map<String, Vote>> reports, int n) {
        int f = (n - 1) / 3;
        int required = 2 * f + 1;
        Set<String> faulty = detectFaulty(announced, reports);
        int yes = 0;
        int no = 0;
        for (Map.Entry<String, Vote> e : announced.entrySet()) {
            if (faulty.contains(e.getKey())) {
                continue;
            }
            if (e.getValue() == Vote.YES) {
                yes++;
            } else if (e.getValue() == Vote.NO) {
                no++;
            }
        }
        ProposalOutcome outcome = yes >= required ? ProposalOutcome.APPROVED : ProposalOutcome.REJECTED;
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("fault_tolerance", f);
        detail.put("required_agreement", required);
        detail.put("honest_responders", announced.size() - faulty.size());
        detail.put("faulty_agents", List.copyOf(faulty));
        detail.put("byzantine_safe", yes >= required || no >= required);
        return new ConsensusDecision(outcome, yes, no, n - yes - no, detail);
    }

    static Set<String> detectFaulty(Map<String, Vote> announced, Map<String, Map<String, Vote>> reports) {
        Set<String> faulty = new TreeSet<>();
        Map<String, Vote> consensusView = majorityView(announced.keySet(), reports);
        for (Map.Entry<String, Map<String, Vote>> r : reports.entrySet()) {
            String reporter = r.getKey();
            Map<String, Vote> view = r.getValue();
            Vote self = view.get(reporter);
            if (self != null && self != announced.get(reporter)) {
                faulty.add(reporter);
                continue;
            }
            for (Map.Entry<String, Vote> claim : view.entrySet()) {
                String subject = claim.getKey();
                if (subject.equals(reporter) || !announced.containsKey(subject)) {
                    continue;
                }
                Vote majority = consensusView.get(subject);
                if (majority != null && majority != claim.getValue()) {
                    faulty.add(reporter);
                    break;
                }
            }
        }
        return faulty;
    }

    private static Map<String, Vote> majorityView(Set<String> subjects, Map<String, Map<String, Vote>> reports) {
        Map<String, Vote> out = new TreeMap<>();
        for (String subject : subjects) {
            Map<Vote, Integer> tally = new EnumMap<>(Vote.class);
            int claims = 0;
            for (Map.Entry<String, Map<String, Vote>> r : reports.entrySet()) {
                if (r.getKey().equals(subject)) {
                    continue;
                }
                Vote v = r.getValue().get(subject);
                if (v != null) {
                    tally.merge(v, 1, Integer::sum);
                    claims++;
                }
            }
            for (Map.Entry<Vote, Integer> t : tally.entrySet()) {
                if (t.getValue() * 2 > claims) {
                    out.put(subject, t.getKey());
                }
            }
        }
        return out;
    }
}
