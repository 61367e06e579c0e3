package com.elssolution.greenguard.service;

import com.elssolution.greenguard.domain.GeoLocation;
import com.elssolution.greenguard.integration.WeatherProvider.LiveWeather;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.SplittableRandom;

/**
 * Stand-in weather and grid values for when a live source is missing or failed.
 * Output is a pure function of (coordinates, hour of the timestamp).
 */
@Component
public class SyntheticContext {

    static final double TROPIC_LAT = 23.5;
    static final double POLAR_LAT  = 66.5;
    static final double RAIN_PROBABILITY = 0.1;

    static final double GRID_BASE_MIN = 300.0;
    static final double GRID_BASE_SPAN = 400.0;
    static final double PEAK_FACTOR = 1.2;

    private static final String[] TROPICAL_CONDITIONS  = {"Clear", "Partly Cloudy"};
    private static final String[] TEMPERATE_CONDITIONS = {"Clear", "Partly Cloudy", "Cloudy"};
    private static final String[] POLAR_CONDITIONS     = {"Cloudy", "Snow"};

    public LiveWeather weather(GeoLocation location, Instant at) {
        double lat = location.clampedLatitude();
        SplittableRandom rnd = seeded(location, at);
        double absLat = Math.abs(lat);

        double temp;
        String condition;
        int humidity;
        if (absLat < TROPIC_LAT) {
            boolean rain = rnd.nextDouble() < RAIN_PROBABILITY;
            temp = 28 + rnd.nextDouble() * 4;                 // 28..32
            condition = rain ? "Rain" : pick(rnd, TROPICAL_CONDITIONS);
            humidity = 70 + rnd.nextInt(20);                  // 70..89
        } else if (absLat < POLAR_LAT) {
            boolean rain = rnd.nextDouble() < RAIN_PROBABILITY;
            temp = 15 + rnd.nextDouble() * 15;                // 15..30
            condition = rain ? "Rain" : pick(rnd, TEMPERATE_CONDITIONS);
            humidity = 50 + rnd.nextInt(30);                  // 50..79
        } else {
            temp = -5 + rnd.nextDouble() * 15;                // -5..10
            condition = pick(rnd, POLAR_CONDITIONS);
            humidity = 60 + rnd.nextInt(20);                  // 60..79
        }
        return new LiveWeather(Math.round(temp * 10.0) / 10.0, condition, humidity);
    }

    /** Western longitudes get the lower base (more renewables); peak windows add 20%. */
    public double gridIntensity(GeoLocation location, Instant at) {
        double lon = location.clampedLongitude();
        double regionFactor = (lon + 180.0) / 360.0;
        double base = GRID_BASE_MIN + regionFactor * GRID_BASE_SPAN;
        double factor = isPeakHour(localSolarHour(lon, at)) ? PEAK_FACTOR : 1.0;
        return Math.round(base * factor);
    }

    /** 06:00-10:59 and 18:00-21:59. */
    static boolean isPeakHour(int hour) {
        return (hour >= 6 && hour <= 10) || (hour >= 18 && hour <= 21);
    }

    /** Hour of day at UTC + round(lon / 15). */
    static int localSolarHour(double longitude, Instant at) {
        int offsetHours = (int) Math.round(longitude / 15.0);
        return at.atOffset(ZoneOffset.ofHours(offsetHours)).getHour();
    }

    private static SplittableRandom seeded(GeoLocation location, Instant at) {
        long seed = Double.doubleToLongBits(location.clampedLatitude());
        seed = 31 * seed + Double.doubleToLongBits(location.clampedLongitude());
        seed = 31 * seed + at.truncatedTo(ChronoUnit.HOURS).getEpochSecond();
        return new SplittableRandom(seed);
    }

    private static String pick(SplittableRandom rnd, String[] options) {
        return options[rnd.nextInt(options.length)];
    }
}
