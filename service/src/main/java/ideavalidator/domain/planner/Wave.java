package ideavalidator.domain.planner;

import ideavalidator.domain.specialist.Specialist;

import java.util.List;

/**
 * Specialists that can be dispatched together because everything they depend on is resolved by earlier waves.
 *
 * @param index       The zero based position of the wave in the plan
 * @param specialists The members of the wave, in registry order
 */
public record Wave(int index, List<Specialist> specialists) {
    public Wave {
        specialists = List.copyOf(specialists);
    }

    public int size() {
        return specialists.size();
    }
}
