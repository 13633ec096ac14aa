package com.nearbyproducts.model;

import java.math.BigDecimal;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One product record returned by the search index.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Hit {
    private String objectID;
    private String handle;
    private String title;

    @JsonProperty("product_image")
    private String productImage;

    private String image;
    private BigDecimal price;
    private String vendor;

    @JsonProperty("featured")
    private Boolean featured;

    @JsonProperty("_geoloc")
    private GeoLoc geoloc;

    private Meta meta;

    public String getObjectID() {
        return objectID;
    }

    public void setObjectID(String objectID) {
        this.objectID = objectID;
    }

    public String getHandle() {
        return handle;
    }

    public void setHandle(String handle) {
        this.handle = handle;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getProductImage() {
        return productImage;
    }

    public void setProductImage(String productImage) {
        this.productImage = productImage;
    }

    public String getImage() {
        return image;
    }

    public void setImage(String image) {
        this.image = image;
    }

    public BigDecimal getPrice() {
        return price;
    }

    public void setPrice(BigDecimal price) {
        this.price = price;
    }

    public String getVendor() {
        return vendor;
    }

    public void setVendor(String vendor) {
        this.vendor = vendor;
    }

    public Boolean getFeatured() {
        return featured;
    }

    public void setFeatured(Boolean featured) {
        this.featured = featured;
    }

    public GeoLoc getGeoloc() {
        return geoloc;
    }

    public void setGeoloc(GeoLoc geoloc) {
        this.geoloc = geoloc;
    }

    public Meta getMeta() {
        return meta;
    }

    public void setMeta(Meta meta) {
        this.meta = meta;
    }

    @JsonIgnore
    public boolean isFeatured() {
        return Boolean.TRUE.equals(featured);
    }

    /**
     * The preferred display image: {@code product_image}, else {@code image}, else null.
     */
    @JsonIgnore
    public String getImageUrl() {
        if (productImage != null && !productImage.isEmpty()) {
            return productImage;
        }
        if (image != null && !image.isEmpty()) {
            return image;
        }
        return null;
    }

    @JsonIgnore
    public LocationDetails getLocationDetails() {
        if (meta == null || meta.getLocation() == null) {
            return null;
        }
        return meta.getLocation().getDetails();
    }

    @JsonIgnore
    public void setLocationDetails(LocationDetails details) {
        if (meta == null) {
            meta = new Meta();
        }
        if (meta.getLocation() == null) {
            meta.setLocation(new Location());
        }
        meta.getLocation().setDetails(details);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class GeoLoc {
        private Double lat;
        private Double lng;

        public Double getLat() {
            return lat;
        }

        public void setLat(Double lat) {
            this.lat = lat;
        }

        public Double getLng() {
            return lng;
        }

        public void setLng(Double lng) {
            this.lng = lng;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Meta {
        private Location location;

        public Location getLocation() {
            return location;
        }

        public void setLocation(Location location) {
            this.location = location;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Location {
        private LocationDetails details;

        public LocationDetails getDetails() {
            return details;
        }

        public void setDetails(LocationDetails details) {
            this.details = details;
        }
    }
}
