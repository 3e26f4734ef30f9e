package com.company.footprint.footprint;

import lombok.Value;

/**
 * Estimated emissions (grams CO2e) and energy cost of some amount of work.
 */
@Value
public class Footprint {

    public static final Footprint ZERO = new Footprint(0, 0);

    double co2e;
    double cost;

    public Footprint minus(Footprint other) {
        return new Footprint(co2e - other.co2e, cost - other.cost);
    }
}
