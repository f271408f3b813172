package io.syncbridge.demo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot demo of the SyncBridge starter.
 *
 * <p>Listings written through {@link ListingController} are captured in the same transaction
 * and mirrored to the external platform. The platform is played by
 * {@link FakePlatformController} on the same port.
 *
 * <p>Run with: mvn install -DskipTests && mvn -f samples/syncbridge-spring-boot-demo/pom.xml spring-boot:run
 *
 * <p>Endpoints:
 * POST   /listings?title=Loft&price=120      - create a listing
 * PUT    /listings/{id}?price=99             - update a listing
 * DELETE /listings/{id}                      - delete a listing
 * POST   /proposals/{listingId}/accept       - start the proposal_accepted workflow
 * GET    /sync-queue                        - list queue rows
 * POST   /process-queue {"action": "..."}    - operator endpoint
 */
@SpringBootApplication
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }
}
