package teranet.mapdev.listings.model;

/**
 * Column names of the listings data set that the cleaning rules, derived features and
 * quality checks refer to (after column-name normalization).
 */
public final class ListingColumns {

    private ListingColumns() {
    }

    // Source columns
    public static final String ID = "id";
    public static final String PRICE = "price";
    public static final String MINIMUM_NIGHTS = "minimum_nights";
    public static final String AVAILABILITY_365 = "availability_365";
    public static final String LAST_REVIEW = "last_review";
    public static final String NUMBER_OF_REVIEWS = "number_of_reviews";
    public static final String CALCULATED_HOST_LISTINGS_COUNT = "calculated_host_listings_count";

    // Derived features
    public static final String PRICE_PER_NIGHT = "price_per_night";
    public static final String HAS_AVAILABILITY = "has_availability";
    public static final String IS_AVAILABLE = "is_available";
    public static final String REVIEW_RECENCY = "review_recency";
    public static final String DAYS_SINCE_LAST_REVIEW = "days_since_last_review";
    public static final String IS_SUPERHOST = "is_superhost";

    /** Value of the review-recency features for listings that were never reviewed. */
    public static final long NO_REVIEW_SENTINEL = -1L;

    /** is_superhost: strictly more reviews than this. */
    public static final long SUPERHOST_MIN_REVIEWS = 50L;

    /** is_superhost: at most this many listings for the host. */
    public static final long SUPERHOST_MAX_HOST_LISTINGS = 3L;
}
