package com.fleet.moderation.api;

import com.fleet.moderation.cache.CacheStatus;
import com.fleet.moderation.core.model.MembershipInfo;
import com.fleet.moderation.core.model.MemberRole;
import com.fleet.moderation.core.model.ModerationRights;
import com.fleet.moderation.core.model.Person;
import com.fleet.moderation.core.model.Scope;
import com.fleet.moderation.remote.RemoteCallException;
import com.fleet.moderation.resolve.ReplyContext;
import com.fleet.moderation.support.FakeTicker;
import com.fleet.moderation.support.InMemoryIdentityService;
import com.fleet.moderation.support.InMemoryRoster;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FleetModeratorTest {

    private static final Person SELF = Person.of(1L, "Agent");
    private static final Person SPAMMER = new Person(500L, "Spam", "Bot", "spammer", 42L);
    private static final Person MOD = new Person(600L, "Mod", null, "mod", 43L);
    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private InMemoryRoster roster;
    private InMemoryIdentityService identities;
    private FakeTicker ticker;
    private FleetModerator moderator;

    @BeforeEach
    void setUp() {
        roster = new InMemoryRoster()
                .addAdministeredScope(10, "Alpha", SELF)
                .addAdministeredScope(20, "Beta", SELF)
                .addAdministeredScope(30, "Gamma", SELF)
                .addScope(Scope.of(40, "Member only"));
        roster.setMembership(40, SELF.id(), MembershipInfo.member(SELF));
        roster.setMembership(10, MOD.id(), MembershipInfo.admin(MOD, false));
        identities = new InMemoryIdentityService(SELF).register(SPAMMER).register(MOD);
        ticker = new FakeTicker();
        moderator = newModerator(ModerationOptions.defaults());
    }

    private FleetModerator newModerator(ModerationOptions options) {
        return FleetModerator.builder()
                .rosterService(roster)
                .identityService(identities)
                .options(options)
                .ticker(ticker)
                .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                .build();
    }

    @AfterEach
    void tearDown() {
        moderator.close();
    }

    @Nested
    @DisplayName("Fleet-wide actions")
    class FleetWide {

        @Test
        @DisplayName("superBan fully bans the target in every administered scope")
        void testSuperBan() {
            ModerationResult result = moderator.superBan("@spammer", null, null);

            assertEquals(ModerationResult.Status.COMPLETED, result.status());
            assertEquals(3, result.outcome().succeeded());
            assertEquals("cross-scope violation", result.reason());
            assertTrue(roster.changes().stream().allMatch(c -> c.rights().equals(ModerationRights.fullBan())));
            assertEquals(List.of(10L, 20L, 30L),
                    roster.changes().stream().map(c -> c.scopeId()).sorted().toList());
            // full exclusion purges history in every scope
            assertEquals(3, roster.purges().size());
        }

        @Test
        @DisplayName("superUnban lifts restrictions and reports partial failure")
        void testSuperUnbanPartial() {
            roster.setRightsRule((scopeId, target, rights) -> {
                if (scopeId == 20L) {
                    throw new RemoteCallException("no rights");
                }
            });

            ModerationResult result = moderator.superUnban("500", null);

            assertEquals(ModerationResult.Status.COMPLETED, result.status());
            assertEquals(2, result.outcome().succeeded());
            assertEquals(List.of("Beta"), result.failuresToShow(3));
            assertNull(result.reason());
        }

        @Test
        @DisplayName("superBan is FAILED when no scope applied the change")
        void testAllFailed() {
            roster.setRightsRule((scopeId, target, rights) -> {
                throw new RemoteCallException("flood wait");
            });

            assertEquals(ModerationResult.Status.FAILED, moderator.superBan("@spammer", null, "spam").status());
        }

        @Test
        @DisplayName("superBan reports NO_SCOPES when nothing is administered")
        void testNoScopes() {
            InMemoryRoster empty = new InMemoryRoster();
            try (FleetModerator lonely = FleetModerator.builder()
                    .rosterService(empty).identityService(identities).build()) {
                assertEquals(ModerationResult.Status.NO_SCOPES, lonely.superBan("@spammer", null, null).status());
            }
        }

        @Test
        @DisplayName("A bare username is rejected before any remote call")
        void testInvalidTarget() {
            ModerationResult result = moderator.superBan("spammer", null, null);

            assertEquals(ModerationResult.Status.INVALID_TARGET, result.status());
            assertNull(result.target());
            assertEquals(0, roster.enumerateCalls());
            assertEquals(0, identities.resolveCalls());
        }

        @Test
        @DisplayName("An unknown id that no scope holds is NOT_LOCATABLE")
        void testNotLocatable() {
            assertEquals(ModerationResult.Status.NOT_LOCATABLE, moderator.superBan("123456", null, null).status());
            assertTrue(roster.changes().isEmpty());
        }

        @Test
        @DisplayName("The reply sender is used when no argument is given")
        void testReplyTarget() {
            ModerationResult result = moderator.superBan(null, ReplyContext.from(SPAMMER), null);

            assertEquals(SPAMMER.id(), result.target().id());
            assertTrue(result.isCompleted());
        }
    }

    @Nested
    @DisplayName("Single-scope actions")
    class SingleScope {

        @Test
        @DisplayName("ban applies a ban with the default reason")
        void testBan() {
            ModerationResult result = moderator.ban(10, "@spammer", null, null);

            assertEquals(ModerationResult.Status.COMPLETED, result.status());
            assertEquals("spam", result.reason());
            assertEquals(ModerationRights.ban(), roster.changes().get(0).rights());
        }

        @Test
        @DisplayName("Restricting an administrator is refused")
        void testAdminRefused() {
            assertEquals(ModerationResult.Status.TARGET_IS_ADMIN, moderator.ban(10, "@mod", null, null).status());
            assertEquals(ModerationResult.Status.TARGET_IS_ADMIN, moderator.kick(10, "@mod", null, null).status());
            assertEquals(ModerationResult.Status.TARGET_IS_ADMIN,
                    moderator.mute(10, "@mod", null, 5, null).status());
            assertTrue(roster.changes().isEmpty());
        }

        @Test
        @DisplayName("Lifting actions may target administrators")
        void testUnbanAdmin() {
            assertEquals(ModerationResult.Status.COMPLETED, moderator.unban(10, "@mod", null).status());
        }

        @Test
        @DisplayName("Acting in a scope without moderation rights is refused")
        void testInsufficientRights() {
            assertEquals(ModerationResult.Status.INSUFFICIENT_RIGHTS,
                    moderator.ban(40, "@spammer", null, null).status());
            assertEquals(ModerationResult.Status.INSUFFICIENT_RIGHTS,
                    moderator.unmute(40, "@spammer", null).status());
        }

        @Test
        @DisplayName("kick expels then lifts the exclusion")
        void testKick() {
            ModerationResult result = moderator.kick(10, "@spammer", null, "flooding");

            assertTrue(result.isCompleted());
            assertEquals("flooding", result.reason());
            assertEquals(List.of(ModerationRights.expel(), ModerationRights.unban()),
                    roster.changes().stream().map(c -> c.rights()).toList());
        }

        @Test
        @DisplayName("mute clamps its duration and reports the expiry")
        void testMute() {
            ModerationResult result = moderator.mute(10, "@spammer", null, 5000, null);

            assertEquals(NOW.plus(Duration.ofMinutes(1440)), result.expiresAt());
            assertEquals("disruptive messages", result.reason());
            assertEquals(result.expiresAt(), roster.changes().get(0).rights().until());

            assertEquals(60, FleetModerator.clampMinutes(null));
            assertEquals(1, FleetModerator.clampMinutes(0));
        }

        @Test
        @DisplayName("A failed rights change is reported as FAILED")
        void testFailed() {
            roster.setRightsRule((scopeId, target, rights) -> {
                throw new RemoteCallException("user not participant");
            });

            ModerationResult result = moderator.unmute(10, "@spammer", null);

            assertEquals(ModerationResult.Status.FAILED, result.status());
            assertEquals(1, result.outcome().failed());
        }
    }

    @Nested
    @DisplayName("Cache lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("preload warms the scope cache")
        void testPreload() {
            assertEquals(3, moderator.preload());
            moderator.superUnban("@spammer", null);

            assertEquals(1, roster.enumerateCalls());
        }

        @Test
        @DisplayName("refreshCaches rebuilds the scope list")
        void testRefresh() {
            moderator.preload();
            roster.addAdministeredScope(50, "Delta", SELF);

            assertEquals(4, moderator.refreshCaches());
            assertEquals(2, roster.enumerateCalls());
        }

        @Test
        @DisplayName("cacheStatus describes an unbounded cache")
        void testStatus() {
            moderator.preload();

            CacheStatus status = moderator.cacheStatus();
            assertTrue(status.unbounded());
            assertEquals(3, status.scopeCount());
            assertNull(status.remainingTtl());
        }

        @Test
        @DisplayName("A bounded cache rebuilds after its time-to-live")
        void testTtl() {
            moderator.close();
            moderator = newModerator(ModerationOptions.builder().cacheTtl(Duration.ofMinutes(30)).build());
            moderator.preload();

            ticker.advance(Duration.ofMinutes(31));
            moderator.evictExpired();
            moderator.getScopes();

            assertEquals(2, roster.enumerateCalls());
        }

        @Test
        @DisplayName("invalidate forces the next call to rebuild")
        void testInvalidate() {
            moderator.preload();
            moderator.invalidate();
            moderator.getScopes();

            assertEquals(2, roster.enumerateCalls());
        }
    }

    @Nested
    @DisplayName("Options and builder")
    class Options {

        @Test
        @DisplayName("Defaults match the documented values")
        void testDefaults() {
            ModerationOptions options = ModerationOptions.defaults();

            assertEquals(10, options.getProbeBatchSize());
            assertEquals(8, options.getParallelLimit());
            assertEquals(2000, options.getPerScopeScanLimit());
            assertTrue(options.isMembershipProbeFirst());
            assertEquals(20, options.getDispatchChunkSize());
            assertEquals(10, options.getProgressInterval());
            assertNull(options.getCacheTtl());
            assertEquals(Duration.ofSeconds(60), options.getLockTimeout());
            assertEquals(3, options.getMaxFailureNames());
        }

        @Test
        @DisplayName("Invalid options are rejected")
        void testValidation() {
            assertThrows(IllegalArgumentException.class, () -> ModerationOptions.builder().parallelLimit(0).build());
            assertThrows(IllegalArgumentException.class,
                    () -> ModerationOptions.builder().lockTimeout(Duration.ZERO).build());
        }

        @Test
        @DisplayName("Builder requires both remote services")
        void testBuilderRequirements() {
            assertThrows(IllegalStateException.class,
                    () -> FleetModerator.builder().identityService(identities).build());
            assertThrows(IllegalStateException.class,
                    () -> FleetModerator.builder().rosterService(roster).build());
        }

        @Test
        @DisplayName("Moderator exposes the options it was built with")
        void testOptionsExposed() {
            ModerationOptions options = ModerationOptions.builder().dispatchChunkSize(5).build();
            try (FleetModerator custom = newModerator(options)) {
                assertSame(options, custom.getOptions());
            }
        }

        @Test
        @DisplayName("Only fleet-wide actions span every scope, only punitive scope actions spare admins")
        void testActionKinds() {
            assertTrue(ModerationAction.SUPER_BAN.isFleetWide());
            assertFalse(ModerationAction.BAN.isFleetWide());
            assertTrue(ModerationAction.KICK.refusesAdministrators());
            assertFalse(ModerationAction.SUPER_BAN.refusesAdministrators());
            assertFalse(ModerationAction.UNMUTE.refusesAdministrators());
        }

        @Test
        @DisplayName("Administrator roles are recognised")
        void testRoles() {
            assertTrue(MemberRole.CREATOR.isAdministrator());
            assertFalse(MemberRole.MEMBER.isAdministrator());
        }
    }
}
