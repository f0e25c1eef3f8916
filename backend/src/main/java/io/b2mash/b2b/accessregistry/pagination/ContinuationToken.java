package io.b2mash.b2b.accessregistry.pagination;

/**
 * Position in a listing: the sort key of the first item of the next page and, for listings scoped
 * to one aggregate, the aggregate version observed when the first page was served.
 */
public record ContinuationToken(String resumeKey, Long version) {

  public static ContinuationToken of(String resumeKey) {
    return new ContinuationToken(resumeKey, null);
  }

  public static ContinuationToken of(String resumeKey, long version) {
    return new ContinuationToken(resumeKey, version);
  }
}
