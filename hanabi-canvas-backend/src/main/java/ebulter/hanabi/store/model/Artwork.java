package ebulter.hanabi.store.model;

import com.google.gson.annotations.SerializedName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A saved pixel drawing with its metadata.
 * Instances are values: changing the like state produces a new instance.
 */
public class Artwork {
    private String id;
    private String name;
    private List<PixelEntry> pixels;
    private int width;
    private int height;
    private long createdTimestamp; // Unix timestamp (seconds)
    @SerializedName("isLiked")
    private boolean liked;

    private Artwork() {
    }

    public Artwork(String id, String name, List<PixelEntry> pixels, int width, int height, long createdTimestamp) {
        this(id, name, pixels, width, height, createdTimestamp, false);
    }

    public Artwork(String id, String name, List<PixelEntry> pixels, int width, int height,
                   long createdTimestamp, boolean liked) {
        this.id = id;
        this.name = name;
        this.pixels = pixels == null ? new ArrayList<>() : new ArrayList<>(pixels);
        this.width = width;
        this.height = height;
        this.createdTimestamp = createdTimestamp;
        this.liked = liked;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public List<PixelEntry> getPixels() {
        return pixels == null ? List.of() : Collections.unmodifiableList(pixels);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public long getCreatedTimestamp() {
        return createdTimestamp;
    }

    public boolean isLiked() {
        return liked;
    }

    /**
     * Returns a copy with the like state flipped, all other fields preserved
     */
    public Artwork withLikeToggled() {
        return new Artwork(id, name, pixels, width, height, createdTimestamp, !liked);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        Artwork artwork = (Artwork) o;
        return width == artwork.width
                && height == artwork.height
                && createdTimestamp == artwork.createdTimestamp
                && liked == artwork.liked
                && Objects.equals(id, artwork.id)
                && Objects.equals(name, artwork.name)
                && getPixels().equals(artwork.getPixels());
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, getPixels(), width, height, createdTimestamp, liked);
    }

    @Override
    public String toString() {
        return "Artwork{id='" + id + "', name='" + name + "', pixels=" + getPixels().size()
                + ", " + width + "x" + height + ", liked=" + liked + "}";
    }
}
