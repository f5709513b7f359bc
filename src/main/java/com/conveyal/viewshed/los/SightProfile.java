package com.conveyal.viewshed.los;

import gnu.trove.list.array.TDoubleArrayList;

/**
 * The intermediate samples along one sight line, ordered by increasing distance from the observer. Terrain is NaN
 * where it touched no-data. Evaluation normally does not build one of these: they are produced on request by
 * LineOfSight.profile() for inspecting why a particular cell is or is not visible.
 */
public class SightProfile {

    /** Distance of the target itself from the observer, in world units. */
    public final double targetDistance;

    private final TDoubleArrayList distances = new TDoubleArrayList();
    private final TDoubleArrayList terrain = new TDoubleArrayList();
    private final TDoubleArrayList lineOfSight = new TDoubleArrayList();

    public SightProfile (double targetDistance) {
        this.targetDistance = targetDistance;
    }

    void add (double distance, double terrainElevation, double lineOfSightElevation) {
        distances.add(distance);
        terrain.add(terrainElevation);
        lineOfSight.add(lineOfSightElevation);
    }

    public int size () {
        return distances.size();
    }

    public double distance (int i) {
        return distances.get(i);
    }

    public double terrain (int i) {
        return terrain.get(i);
    }

    public double lineOfSight (int i) {
        return lineOfSight.get(i);
    }

    public int noDataCount () {
        int count = 0;
        for (int i = 0; i < terrain.size(); i++) {
            if (Double.isNaN(terrain.get(i))) count += 1;
        }
        return count;
    }

    /**
     * The largest amount by which terrain rises above the sight line, or negative infinity if there are no known
     * samples. A positive value means the target is hidden at that point.
     */
    public double maxObstruction () {
        double max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < terrain.size(); i++) {
            double t = terrain.get(i);
            if (!Double.isNaN(t)) {
                max = Math.max(max, t - lineOfSight.get(i));
            }
        }
        return max;
    }

}
