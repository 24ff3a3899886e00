package ebulter.hanabi.store.model;

import java.util.Objects;

public class PixelEntry {
    private int x;
    private int y;
    private PixelColor color;

    private PixelEntry() {
    }

    public PixelEntry(int x, int y, PixelColor color) {
        this.x = x;
        this.y = y;
        this.color = color;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    public PixelColor getColor() {
        return color;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        PixelEntry that = (PixelEntry) o;
        return x == that.x && y == that.y && Objects.equals(color, that.color);
    }

    @Override
    public int hashCode() {
        int result = x;
        result = 31 * result + y;
        result = 31 * result + Objects.hashCode(color);
        return result;
    }
}
