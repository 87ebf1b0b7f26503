package com.dcruver.regmetrics.io;

import lombok.Value;

import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One bulk markup file and the (year, title, volume) it covers.
 * Bulk files are named {@code CFR-<year>-title<n>-vol<v>.xml}.
 */
@Value
public class SourceFile implements Comparable<SourceFile> {

    private static final Pattern BULK_NAME = Pattern.compile("CFR-(\\d+)-title(\\d+)-vol(\\d+)", Pattern.CASE_INSENSITIVE);

    Path path;
    String year;
    String titleNumber;
    String volume;

    /**
     * Derive year, title and volume from a bulk file name
     */
    public static Optional<SourceFile> fromPath(Path path) {
        Matcher matcher = BULK_NAME.matcher(path.getFileName().toString());
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(new SourceFile(path, matcher.group(1), matcher.group(2), matcher.group(3)));
    }

    /**
     * Key of the storage unit this file contributes to: one TitleFile per (year, title)
     */
    public String unitKey() {
        return year + "/" + titleNumber;
    }

    public int volumeNumber() {
        return Integer.parseInt(volume);
    }

    @Override
    public int compareTo(SourceFile other) {
        int byVolume = Integer.compare(volumeNumber(), other.volumeNumber());
        return byVolume != 0 ? byVolume : path.toString().compareTo(other.path.toString());
    }

    @Override
    public String toString() {
        return path.getFileName().toString();
    }
}
