package com.fintech.bankrec.service.split;

import com.fintech.bankrec.config.ReconciliationConfig;
import com.fintech.bankrec.value.Money;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Finds a subset of candidates whose amounts sum to an anchor amount within one cent.
 * <p>
 * Candidates are tried largest first, which makes the first descent of the search the
 * greedy path; on overshoot the search backtracks. Depth is capped at
 * {@link ReconciliationConfig#HARD_MAX_SPLIT_MEMBERS} members and the pool at a small
 * number of candidates, so the search always terminates quickly.
 */
@Component
@Slf4j
public class SplitGroupResolver {

    static final Money SPLIT_TOLERANCE = Money.ONE_CENT;
    static final int DEFAULT_MAX_CANDIDATES = 12;

    private static final Comparator<SplitCandidate> LARGEST_FIRST = Comparator
            .comparing(SplitCandidate::getAmount).reversed()
            .thenComparing(SplitCandidate::getId);

    public SplitResolution resolveSplit(Money anchorAmount, Collection<SplitCandidate> candidateMembers) {
        return resolveSplit(anchorAmount, candidateMembers,
                ReconciliationConfig.HARD_MAX_SPLIT_MEMBERS, DEFAULT_MAX_CANDIDATES);
    }

    public SplitResolution resolveSplit(Money anchorAmount, Collection<SplitCandidate> candidateMembers,
                                        int maxMembers, int maxCandidates) {
        int memberCap = Math.max(2, Math.min(maxMembers, ReconciliationConfig.HARD_MAX_SPLIT_MEMBERS));

        // Work on magnitudes; credits split the same way as debits.
        boolean negative = anchorAmount.isNegative();
        Money target = anchorAmount.abs();
        if (target.isZero()) {
            return SplitResolution.failed(anchorAmount, SplitError.SPLIT_NOT_FOUND);
        }

        List<SplitCandidate> eligible = new ArrayList<>();
        for (SplitCandidate candidate : candidateMembers) {
            Money amount = negative ? candidate.getAmount().negate() : candidate.getAmount();
            if (!amount.isPositive()) {
                continue;
            }
            if (amount.isWithin(target, SPLIT_TOLERANCE)) {
                log.debug("Candidate {} alone satisfies anchor {}, not a split", candidate.getId(), anchorAmount);
                return SplitResolution.failed(anchorAmount, SplitError.NOT_A_SPLIT);
            }
            if (amount.isLessThan(target)) {
                eligible.add(SplitCandidate.of(candidate.getId(), amount));
            }
        }

        eligible.sort(LARGEST_FIRST);
        List<SplitCandidate> pool = eligible.size() > maxCandidates
                ? new ArrayList<>(eligible.subList(0, maxCandidates))
                : eligible;
        if (pool.size() < 2) {
            return SplitResolution.failed(anchorAmount, SplitError.SPLIT_NOT_FOUND);
        }

        Money[] remaining = new Money[pool.size() + 1];
        remaining[pool.size()] = Money.ZERO;
        for (int i = pool.size() - 1; i >= 0; i--) {
            remaining[i] = remaining[i + 1].plus(pool.get(i).getAmount());
        }

        Deque<Integer> chosen = new ArrayDeque<>();
        if (!search(pool, remaining, target, memberCap, 0, Money.ZERO, chosen)) {
            log.debug("No subset of {} candidate(s) sums to {}", pool.size(), anchorAmount);
            return SplitResolution.failed(anchorAmount, SplitError.SPLIT_NOT_FOUND);
        }

        List<SplitCandidate> members = new ArrayList<>();
        // Deque is used as a stack; iterate from the bottom to keep descending-amount order.
        Iterator<Integer> fromBottom = chosen.descendingIterator();
        while (fromBottom.hasNext()) {
            SplitCandidate member = pool.get(fromBottom.next());
            members.add(negative ? SplitCandidate.of(member.getId(), member.getAmount().negate()) : member);
        }
        return SplitResolution.resolved(anchorAmount, members);
    }

    private boolean search(List<SplitCandidate> eligible, Money[] remaining, Money target, int memberCap,
                           int start, Money runningTotal, Deque<Integer> chosen) {
        if (chosen.size() >= 2 && runningTotal.isWithin(target, SPLIT_TOLERANCE)) {
            return true;
        }
        if (chosen.size() == memberCap) {
            return false;
        }
        Money upperBound = target.plus(SPLIT_TOLERANCE);
        Money lowerBound = target.minus(SPLIT_TOLERANCE);
        for (int i = start; i < eligible.size(); i++) {
            if (runningTotal.plus(remaining[i]).isLessThan(lowerBound)) {
                break;
            }
            Money next = runningTotal.plus(eligible.get(i).getAmount());
            if (next.isGreaterThan(upperBound)) {
                continue;
            }
            chosen.push(i);
            if (search(eligible, remaining, target, memberCap, i + 1, next, chosen)) {
                return true;
            }
            chosen.pop();
        }
        return false;
    }
}
