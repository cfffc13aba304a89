package com.fintech.bankrec.service.split;

import com.fintech.bankrec.value.Money;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of a split search: either an ordered member list or a {@link SplitError}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SplitResolution {

    Money anchorAmount;
    List<SplitCandidate> members;
    SplitError error;

    static SplitResolution resolved(Money anchorAmount, List<SplitCandidate> members) {
        return new SplitResolution(anchorAmount, List.copyOf(members), null);
    }

    static SplitResolution failed(Money anchorAmount, SplitError error) {
        return new SplitResolution(anchorAmount, List.of(), error);
    }

    public boolean isResolved() {
        return error == null;
    }

    public Money total() {
        return Money.sum(members.stream().map(SplitCandidate::getAmount).collect(Collectors.toList()));
    }

    public List<Long> memberIds() {
        return members.stream().map(SplitCandidate::getId).collect(Collectors.toList());
    }
}
