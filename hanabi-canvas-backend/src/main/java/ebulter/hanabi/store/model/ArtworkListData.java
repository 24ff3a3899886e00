package ebulter.hanabi.store.model;

import java.util.List;

/**
 * JSON structure for exported artworks. The list is always wrapped in an object,
 * a bare top-level array is not part of the save format.
 */
public class ArtworkListData {
    private List<Artwork> artworks;

    public ArtworkListData() {}

    public ArtworkListData(List<Artwork> artworks) {
        this.artworks = artworks;
    }

    public List<Artwork> getArtworks() { return artworks; }
    public void setArtworks(List<Artwork> artworks) { this.artworks = artworks; }
}
