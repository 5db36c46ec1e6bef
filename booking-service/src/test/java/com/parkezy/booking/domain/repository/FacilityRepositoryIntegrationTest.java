package com.parkezy.booking.domain.repository;

import com.parkezy.booking.domain.model.Facility;
import com.parkezy.booking.domain.model.FacilityCapacity;
import com.parkezy.booking.domain.model.FacilityType;
import com.parkezy.booking.domain.model.ListingSlot;
import com.parkezy.booking.domain.model.PrivateListing;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Guarded UPDATEs behind the "atomic" capacity strategy and the slot claim, against a real
 * PostgreSQL. Only the JPA layer is loaded (no Redis, no Kafka).
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Testcontainers(disabledWithoutDocker = true)
class FacilityRepositoryIntegrationTest {

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("parkezy_db")
            .withUsername("postgres")
            .withPassword("postgres");

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create");
        registry.add("spring.flyway.enabled", () -> "false");
    }

    @Autowired
    private FacilityRepository facilityRepository;

    @Autowired
    private PrivateListingRepository listingRepository;

    @Autowired
    private ListingSlotRepository slotRepository;

    @Test
    @DisplayName("decrementAvailableIfPositive never takes more units than the facility has")
    void decrementAvailableIfPositive_neverOverbooks() {
        // given
        Long facilityId = facilityRepository.saveAndFlush(facility(5)).getId();
        int successfulUpdates = 0;

        // when: try to take a unit 10 times ( > total )
        for (int i = 0; i < 10; i++) {
            successfulUpdates += facilityRepository.decrementAvailableIfPositive(facilityId);
        }

        // then
        Facility reloaded = facilityRepository.findById(facilityId).orElseThrow();
        assertThat(successfulUpdates).isEqualTo(5);
        assertThat(reloaded.getCapacity().getAvailable()).isZero();
    }

    @Test
    @DisplayName("incrementAvailableBelowTotal stops at total")
    void incrementAvailableBelowTotal_cappedAtTotal() {
        Facility facility = facility(3);
        facility.getCapacity().take();
        Long facilityId = facilityRepository.saveAndFlush(facility).getId();

        assertThat(facilityRepository.incrementAvailableBelowTotal(facilityId)).isEqualTo(1);
        assertThat(facilityRepository.incrementAvailableBelowTotal(facilityId)).isZero();

        assertThat(facilityRepository.findById(facilityId).orElseThrow().getCapacity().getAvailable()).isEqualTo(3);
    }

    @Test
    @DisplayName("findByIdForUpdate sees the row as written by a preceding bulk update")
    void findByIdForUpdate_refreshesManagedEntity() {
        Facility facility = facilityRepository.saveAndFlush(facility(2));
        facilityRepository.findById(facility.getId()).orElseThrow();

        facilityRepository.decrementAvailableIfPositive(facility.getId());

        Facility locked = facilityRepository.findByIdForUpdate(facility.getId()).orElseThrow();
        assertThat(locked.getCapacity().getAvailable()).isEqualTo(1);
    }

    @Test
    @DisplayName("findOwnerIdById returns the owner without loading the facility")
    void findOwnerIdById() {
        Long facilityId = facilityRepository.saveAndFlush(facility(1)).getId();

        assertThat(facilityRepository.findOwnerIdById(facilityId)).contains("owner-1");
        assertThat(facilityRepository.findOwnerIdById(facilityId + 1000)).isEmpty();
    }

    @Test
    @DisplayName("a slot held by one booking cannot be claimed by another, but can be rewritten by its holder")
    void slotClaim_isConditional() {
        PrivateListing listing = listingRepository.saveAndFlush(PrivateListing.builder()
                .hostId("host-1")
                .title("Driveway")
                .address("12 Elm Street")
                .hourlyRate(new BigDecimal("100.00"))
                .autoAcceptBookings(false)
                .build());
        ListingSlot slot = slotRepository.saveAndFlush(
                ListingSlot.builder().listingId(listing.getId()).label("A").build());
        Instant end = Instant.parse("2026-03-01T12:00:00Z");

        assertThat(slotRepository.claim(listing.getId(), slot.getId(), 100L, false, end)).isEqualTo(1);
        assertThat(slotRepository.claim(listing.getId(), slot.getId(), 200L, false, end)).isZero();
        assertThat(slotRepository.claim(listing.getId(), slot.getId(), 100L, true, end)).isEqualTo(1);
        assertThat(slotRepository.releaseIfHeldBy(listing.getId(), slot.getId(), 200L)).isZero();
        assertThat(slotRepository.existsByListingIdAndBookingIdIsNotNull(listing.getId())).isTrue();

        assertThat(slotRepository.releaseIfHeldBy(listing.getId(), slot.getId(), 100L)).isEqualTo(1);
        assertThat(slotRepository.existsByListingIdAndBookingIdIsNotNull(listing.getId())).isFalse();
    }

    private static Facility facility(int total) {
        return Facility.builder()
                .ownerId("owner-1")
                .name("Central Garage")
                .address("1 Main Street")
                .latitude(12.97)
                .longitude(77.59)
                .facilityType(FacilityType.MALL)
                .defaultHourlyRate(new BigDecimal("50.00"))
                .capacity(FacilityCapacity.of(total))
                .build();
    }
}
