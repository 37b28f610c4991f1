package net.myaioutfit.service.storage;

/**
 * An object written to the wardrobe image bucket.
 */
public record StoredObject(String path, String publicUrl) {
}
