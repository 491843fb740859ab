package com.questrail.opendrive.model.road;

import com.questrail.opendrive.model.AdditionalData;
import com.questrail.opendrive.model.lane.Lanes;
import com.questrail.opendrive.model.object.RoadObjects;
import com.questrail.opendrive.model.signal.Signals;
import com.questrail.opendrive.units.Length;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Road
 * -----------------------------------------------------------------------------
 * A {@code <road>}: reference line, profiles, lanes and roadside furniture.
 *
 * <h2>Identity and references</h2>
 * <p>Roads are identified by {@code id}. Membership in a junction is the id of
 * that junction; the document encodes "no junction" as {@code -1}, modelled here
 * as an empty {@link #junction()}. Links to neighbouring roads and junctions are
 * ids as well, resolved through
 * {@link com.questrail.opendrive.model.Document#findRoad(String)} and
 * {@link com.questrail.opendrive.model.Document#findJunction(String)}.</p>
 *
 * <h2>Defaults</h2>
 * <ul>
 *   <li>{@code rule} defaults to {@link TrafficRule#RHT}</li>
 * </ul>
 */
public record Road(
        String id,
        Optional<String> name,
        Length length,
        Optional<String> junction,
        TrafficRule rule,
        Optional<RoadLink> link,
        List<RoadTypeEntry> types,
        PlanView planView,
        Optional<ElevationProfile> elevationProfile,
        Optional<LateralProfile> lateralProfile,
        Lanes lanes,
        Optional<RoadObjects> objects,
        Optional<Signals> signals,
        Optional<RoadSurface> surface,
        AdditionalData additionalData
) {
    /** Value of the {@code junction} attribute for roads outside any junction. */
    public static final String NO_JUNCTION = "-1";

    public static final TrafficRule DEFAULT_RULE = TrafficRule.RHT;

    public Road {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(length, "length");
        Objects.requireNonNull(junction, "junction");
        Objects.requireNonNull(rule, "rule");
        Objects.requireNonNull(link, "link");
        Objects.requireNonNull(planView, "planView");
        Objects.requireNonNull(elevationProfile, "elevationProfile");
        Objects.requireNonNull(lateralProfile, "lateralProfile");
        Objects.requireNonNull(lanes, "lanes");
        Objects.requireNonNull(objects, "objects");
        Objects.requireNonNull(signals, "signals");
        Objects.requireNonNull(surface, "surface");
        Objects.requireNonNull(additionalData, "additionalData");
        types = List.copyOf(types);
        if (junction.isPresent() && NO_JUNCTION.equals(junction.get())) {
            throw new IllegalArgumentException("use an empty junction for roads outside any junction");
        }
    }

    public static Builder builder(String id, PlanView planView, Lanes lanes) {
        return new Builder(id, planView, lanes);
    }

    public Road withLanes(Lanes lanes) {
        return new Road(id, name, length, junction, rule, link, types, planView, elevationProfile,
                lateralProfile, lanes, objects, signals, surface, additionalData);
    }

    public static final class Builder {
        private final String id;
        private final PlanView planView;
        private final Lanes lanes;
        private String name;
        private Length length;
        private String junction;
        private TrafficRule rule = DEFAULT_RULE;
        private RoadLink link;
        private final List<RoadTypeEntry> types = new ArrayList<>();
        private ElevationProfile elevationProfile;
        private LateralProfile lateralProfile;
        private RoadObjects objects;
        private Signals signals;
        private RoadSurface surface;
        private AdditionalData additionalData = AdditionalData.EMPTY;

        private Builder(String id, PlanView planView, Lanes lanes) {
            this.id = id;
            this.planView = planView;
            this.lanes = lanes;
        }

        public Builder withName(String name) {
            this.name = name;
            return this;
        }

        /**
         * Overrides the declared length; by default it is the end of the plan view.
         */
        public Builder withLength(Length length) {
            this.length = length;
            return this;
        }

        public Builder withJunction(String junction) {
            this.junction = junction;
            return this;
        }

        public Builder withRule(TrafficRule rule) {
            this.rule = rule;
            return this;
        }

        public Builder withLink(RoadLink link) {
            this.link = link;
            return this;
        }

        public Builder addType(RoadTypeEntry type) {
            types.add(type);
            return this;
        }

        public Builder withElevationProfile(ElevationProfile elevationProfile) {
            this.elevationProfile = elevationProfile;
            return this;
        }

        public Builder withLateralProfile(LateralProfile lateralProfile) {
            this.lateralProfile = lateralProfile;
            return this;
        }

        public Builder withObjects(RoadObjects objects) {
            this.objects = objects;
            return this;
        }

        public Builder withSignals(Signals signals) {
            this.signals = signals;
            return this;
        }

        public Builder withSurface(RoadSurface surface) {
            this.surface = surface;
            return this;
        }

        public Builder withAdditionalData(AdditionalData additionalData) {
            this.additionalData = additionalData;
            return this;
        }

        public Road build() {
            Length declared = length != null ? length : Length.of(planView.length());
            return new Road(id, Optional.ofNullable(name), declared, Optional.ofNullable(junction), rule,
                    Optional.ofNullable(link), types, planView, Optional.ofNullable(elevationProfile),
                    Optional.ofNullable(lateralProfile), lanes, Optional.ofNullable(objects),
                    Optional.ofNullable(signals), Optional.ofNullable(surface), additionalData);
        }
    }
}
