// ConversionSummary.java

package com.openathena.insar.convert;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.json.JSONArray;
import org.json.JSONObject;

/** Outcome of an orchestrator run: counts plus one entry per failed pair. */
public final class ConversionSummary
{
    /** A pair that could not be converted. */
    public static final class Failure
    {
        private final Path path;
        private final String message;

        public Failure(Path path, String message)
        {
            this.path = path;
            this.message = message;
        }

        public Path getPath() { return path; }
        public String getMessage() { return message; }
    }

    private final int found;
    private final int converted;
    private final long points;
    private final List<Failure> failures;

    public ConversionSummary(int found, int converted, long points, List<Failure> failures)
    {
        this.found = found;
        this.converted = converted;
        this.points = points;
        this.failures = Collections.unmodifiableList(new ArrayList<>(failures));
    }

    public int getFound() { return found; }
    public int getConverted() { return converted; }
    public int getFailed() { return failures.size(); }
    public long getPoints() { return points; }
    public List<Failure> getFailures() { return failures; }

    public JSONObject toJSON()
    {
        JSONObject json = new JSONObject();
        json.put("found", found);
        json.put("converted", converted);
        json.put("failed", getFailed());
        json.put("points", points);
        JSONArray list = new JSONArray();
        for (Failure f : failures) {
            JSONObject o = new JSONObject();
            o.put("path", String.valueOf(f.getPath()));
            o.put("error", f.getMessage());
            list.put(o);
        }
        json.put("failures", list);
        return json;
    }

    @Override
    public String toString()
    {
        return "found " + found + ", converted " + converted + ", failed " + getFailed() + ", " + points + " points";
    }
}
