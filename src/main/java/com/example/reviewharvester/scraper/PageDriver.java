package com.example.reviewharvester.scraper;

import com.example.reviewharvester.browser.BrowserSession;
import com.example.reviewharvester.model.ReviewRecord;
import com.example.reviewharvester.model.ScrollTermination;
import com.example.reviewharvester.model.SortOrder;
import com.example.reviewharvester.model.TargetRecord;
import com.example.reviewharvester.model.TargetResult;
import com.example.reviewharvester.model.TargetStatus;
import com.example.reviewharvester.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashSet;
import java.util.Set;

/**
 * Drives one target through navigate, open reviews, sort, scroll and extract.
 * Every outcome, including failure, comes back as a {@link TargetResult}.
 */
public class PageDriver {
    private static final Logger log = LoggerFactory.getLogger(PageDriver.class);

    enum PageState {
        INIT,
        NAVIGATED,
        REVIEWS_PANEL_OPEN,
        SORT_APPLIED,
        SCROLLING,
        EXTRACTED,
        DONE,
        FAILED
    }

    private final SiteProfile profile;
    private final HarvestConfig config;
    private final Retrier retrier;
    private final ScrollController scroller;
    private final ReviewExtractor extractor;
    private final Sleeper sleeper;

    public PageDriver(SiteProfile profile, HarvestConfig config, Retrier retrier,
                      ScrollController scroller, ReviewExtractor extractor, Sleeper sleeper) {
        this.profile = profile;
        this.config = config;
        this.retrier = retrier;
        this.scroller = scroller;
        this.extractor = extractor;
        this.sleeper = sleeper;
    }

    public static PageDriver create(SiteProfile profile, HarvestConfig config, Sleeper sleeper) {
        Retrier retrier = Retrier.from(config, sleeper);
        return new PageDriver(profile, config, retrier,
                ScrollController.from(config, sleeper),
                new ReviewExtractor(profile, retrier, sleeper, Duration.ofMillis(config.getActionDelayMs() / 2)),
                sleeper);
    }

    public TargetResult harvest(TargetRecord target, BrowserSession session) {
        return new Harvest(target, session).run();
    }

    /** State of one target's pass through the page; discarded afterwards. */
    private final class Harvest {
        private final TargetRecord target;
        private final BrowserSession session;
        private final ReviewAccumulator reviews = new ReviewAccumulator();
        private final Integer requested = config.getMaxReviews();

        private PageState state = PageState.INIT;
        private boolean noReviews;
        private boolean sortAttempted;
        private boolean allSorted = true;
        private ScrollTermination termination;

        Harvest(TargetRecord target, BrowserSession session) {
            this.target = target;
            this.session = session;
        }

        TargetResult run() {
            try {
                for (SortOrder order : config.getSortPasses()) {
                    if (requested != null && reviews.size() >= requested) {
                        break;
                    }
                    runPass(order);
                    if (noReviews) {
                        break;
                    }
                }
                enter(PageState.DONE);
                TargetResult result = TargetResult.finished(target, status(), sortApplied(), termination,
                        reviews.snapshot(requested));
                log.info("Collected {} reviews ({})", result.getReviewCount(), result.getStatus());
                return result;
            } catch (HarvestException e) {
                PageState failedIn = state;
                enter(PageState.FAILED);
                log.warn("Failed in state {} with {}: {}", failedIn, e.kind(), e.getMessage());
                return TargetResult.failed(target, e.kind(), failedIn + ": " + e.getMessage(), sortApplied(),
                        reviews.snapshot(requested));
            }
        }

        private void runPass(SortOrder order) throws HarvestException {
            enter(PageState.INIT);
            navigate();
            enter(PageState.NAVIGATED);

            if (!openReviewsPanel()) {
                log.info("Target has no reviews");
                noReviews = true;
                return;
            }
            enter(PageState.REVIEWS_PANEL_OPEN);

            sortAttempted = true;
            if (!applySort(order)) {
                allSorted = false;
            }
            enter(PageState.SORT_APPLIED);

            enter(PageState.SCROLLING);
            ScrollOutcome outcome = scroller.scroll(new PanelScroll(), requested);
            log.debug("Pass {} stopped on {} after {} scrolls", order, outcome.getTermination(), outcome.getAttempts());
            if (termination != ScrollTermination.ATTEMPT_CAP) {
                termination = outcome.getTermination();
            }
            // the final loadedCount() read extracted the last loaded set
            enter(PageState.EXTRACTED);
        }

        private void navigate() throws HarvestException {
            String url = profile.placeUrl(target);
            retrier.run("navigate", () -> {
                session.navigate(url);
                checkBlocked();
                if (!session.waitForPresent(profile.loadedMarker(), config.pageLoadTimeout())) {
                    checkBlocked();
                    throw NavigationException.timeout(url, null);
                }
            });
        }

        private void checkBlocked() throws HarvestException {
            String url = session.currentUrl();
            if (url != null) {
                for (String marker : profile.blockedUrlMarkers()) {
                    if (url.contains(marker)) {
                        throw new BlockedException(url);
                    }
                }
            }
            String selector = profile.blockedSelector();
            if (selector != null
                    && Boolean.TRUE.equals(session.evaluate(SiteProfile.BLOCK_PROBE_SCRIPT, selector))) {
                throw new BlockedException(url);
            }
        }

        /** True when the panel is open; false when the target legitimately has no reviews. */
        private boolean openReviewsPanel() throws HarvestException {
            return retrier.call("open reviews", () -> {
                String outcome = String.valueOf(session.evaluate(profile.openReviewsScript(), profile.openReviewsArgs()));
                if ("NO_REVIEWS".equals(outcome)) {
                    return false;
                }
                if (!"OPENED".equals(outcome)) {
                    Integer known = target.getKnownReviewCount();
                    if (known != null && known == 0) {
                        return false;
                    }
                    throw new ElementNotFoundException("Reviews tab not found");
                }
                sleeper.sleep(config.actionDelay());
                if (!session.waitForPresent(profile.reviewsPanel(), config.panelTimeout())) {
                    throw new ElementNotFoundException("Reviews panel did not render");
                }
                return true;
            });
        }

        /** Best effort: an unavailable sort control leaves the order undefined but the target alive. */
        private boolean applySort(SortOrder order) throws HarvestException {
            try {
                return retrier.call("sort " + order, () -> {
                    if (!Boolean.TRUE.equals(session.evaluate(profile.sortScript(), profile.sortOpenArgs()))) {
                        throw new ElementNotFoundException("Sort control not found");
                    }
                    if (!session.waitForPresent(profile.sortMenuItem(), config.panelTimeout())) {
                        throw new ElementNotFoundException("Sort menu did not open");
                    }
                    if (!Boolean.TRUE.equals(session.evaluate(profile.sortScript(), profile.sortSelectArgs(order)))) {
                        throw new ElementNotFoundException("Sort option " + order + " not found");
                    }
                    sleeper.sleep(config.actionDelay());
                    return true;
                });
            } catch (HarvestException e) {
                if (!e.isRetryable()) {
                    throw e;
                }
                log.warn("Sort {} unavailable, continuing with the page's default order: {}", order, e.getMessage());
                return false;
            }
        }

        private TargetStatus status() {
            int got = reviews.size();
            Integer known = target.getKnownReviewCount();
            boolean expectsReviews = known != null && known > 0;
            if (noReviews) {
                return TargetStatus.COMPLETE;
            }
            if (got == 0 && termination == ScrollTermination.STAGNATION) {
                // an empty panel only counts as done when the place has no reviews to show
                return expectsReviews ? TargetStatus.PARTIAL_TIMEOUT : TargetStatus.COMPLETE;
            }
            if (requested != null && got >= requested) {
                return TargetStatus.COMPLETE;
            }
            if (termination == ScrollTermination.ATTEMPT_CAP) {
                return TargetStatus.PARTIAL_TIMEOUT;
            }
            if (termination == ScrollTermination.STAGNATION && requested != null) {
                return known != null && got >= known ? TargetStatus.COMPLETE : TargetStatus.PARTIAL_TIMEOUT;
            }
            return TargetStatus.COMPLETE;
        }

        private boolean sortApplied() {
            return sortAttempted && allSorted;
        }

        private void enter(PageState next) {
            log.trace("{} -> {}", state, next);
            state = next;
        }

        /**
         * Scrolls the reviews panel; each read extracts the loaded nodes into the accumulator.
         * The count is per pass so a later sort order is not cut short by reviews an earlier one found.
         */
        private final class PanelScroll implements ScrollablePage {
            private final Set<String> seen = new HashSet<>();

            @Override
            public void advance(int pageHeights) throws HarvestException {
                retrier.run("scroll", () -> {
                    Object height = session.evaluate(profile.scrollScript(), profile.scrollArgs(pageHeights));
                    if (height instanceof Number && ((Number) height).intValue() < 0) {
                        throw new ElementNotFoundException("Reviews panel disappeared");
                    }
                });
            }

            @Override
            public int loadedCount() throws HarvestException {
                for (ReviewRecord r : extractor.extractBatch(session)) {
                    seen.add(r.getFingerprint());
                    reviews.add(r);
                }
                return seen.size();
            }
        }
    }
}
