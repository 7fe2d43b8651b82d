package com.apexframe.core.security;

import com.apexframe.api.event.LifecycleEvents;
import com.apexframe.api.exception.PermissionDeniedException;
import com.apexframe.api.exception.ResourceLimitExceededException;
import com.apexframe.api.exception.ResourceLimitExceededException.LimitType;
import com.apexframe.core.event.EventBus;
import com.apexframe.core.loader.ScanReport;
import com.apexframe.core.manifest.ActionDescriptor;
import com.apexframe.core.manifest.EntryReference;
import com.apexframe.core.manifest.ExtensionManifest;
import com.apexframe.core.version.SemanticVersion;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("权限授予与资源违规")
class ExtensionSecurityManagerTest {

    @Mock
    private ViolationPolicy violationPolicy;

    private final ResourceLimitProfile base = ResourceLimitProfile.defaults();

    private static ExtensionManifest manifest(String id, String... permissions) {
        return ExtensionManifest.builder()
                .id(id)
                .version(SemanticVersion.of(1, 0, 0))
                .entryReference(EntryReference.parse("com.example.Entry"))
                .declaredPermissions(Set.of(permissions))
                .build();
    }

    private ExtensionSecurityManager managerWith(HostPolicy policy) {
        return new ExtensionSecurityManager(() -> policy);
    }

    @Nested
    @DisplayName("授权")
    class AuthorizeTests {

        @Test
        @DisplayName("声明的权限全部被允许时授予")
        void grants() {
            HostPolicy policy = HostPolicy.builder(base)
                    .tier(new TrustTier(HostPolicy.DEFAULT_TIER, Set.of("event.*"), LimitOverrides.none(), false))
                    .build();
            ExtensionSecurityManager manager = managerWith(policy);
            ExtensionManifest m = manifest("a", "event.emit", "event.subscribe");

            PermissionGrant grant = manager.authorize(m, ScanReport.empty(), manager.decide(m));

            assertTrue(grant.has("event.emit"));
            assertEquals(Set.of("event.emit", "event.subscribe"), grant.permissions());
        }

        @Test
        @DisplayName("策略不允许的权限被拒绝并列出")
        void deniesUngranted() {
            ExtensionSecurityManager manager = managerWith(HostPolicy.denyAll(base));
            ExtensionManifest m = manifest("a", "network.connect");

            PermissionDeniedException e = assertThrows(PermissionDeniedException.class,
                    () -> manager.authorize(m, null, manager.decide(m)));
            assertEquals(Set.of("network.connect"), e.getDenied());
        }

        @Test
        @DisplayName("代码需要但未声明的权限被拒绝")
        void deniesUndeclaredCodePermissions() {
            ExtensionSecurityManager manager = managerWith(HostPolicy.allowAll(false, base));
            ExtensionManifest m = manifest("a");
            ScanReport scan = new ScanReport(List.of(),
                    List.of(new ScanReport.Finding("x.A", "java/lang/ProcessBuilder.start", "system.execute")),
                    Set.of("system.execute"));

            PermissionDeniedException e = assertThrows(PermissionDeniedException.class,
                    () -> manager.authorize(m, scan, manager.decide(m)));
            assertEquals(Set.of("system.execute"), e.getDenied());
        }

        @Test
        @DisplayName("动作所需权限必须已授予")
        void checkAction() {
            ExtensionSecurityManager manager = managerWith(HostPolicy.allowAll(false, base));
            PermissionGrant grant = new PermissionGrant("a", "default", Set.of("file.read"));
            ActionDescriptor write = new ActionDescriptor("write", Map.of(), false, Set.of("file.write"));
            ActionDescriptor read = new ActionDescriptor("read", Map.of(), false, Set.of("file.read"));

            assertDoesNotThrow(() -> manager.checkAction("a", grant, read));
            assertThrows(PermissionDeniedException.class, () -> manager.checkAction("a", grant, write));
            assertThrows(PermissionDeniedException.class, () -> manager.checkAction("a", null, read));
        }
    }

    @Nested
    @DisplayName("违规记录")
    class ViolationTests {

        @Test
        @DisplayName("记录违规、发布事件并通知策略")
        void recordsViolation() {
            EventBus bus = new EventBus();
            List<Map<String, Object>> events = new ArrayList<>();
            bus.subscribe(LifecycleEvents.RESOURCE_VIOLATION, 0, null, "test", e -> events.add(e.getPayload()));
            ViolationTracker tracker = new ViolationTracker(bus, violationPolicy);

            tracker.record("slow", new ResourceLimitExceededException("a", LimitType.WALL_CLOCK, "took too long"));
            tracker.record("slow", new ResourceLimitExceededException("a", LimitType.WALL_CLOCK, "took too long"));

            assertEquals(2, tracker.count("a"));
            assertEquals(2, events.size());
            assertEquals("WALL_CLOCK", events.get(1).get("limit_type"));
            assertEquals(2, events.get(1).get("count"));
            ArgumentCaptor<ResourceViolation> captor = ArgumentCaptor.forClass(ResourceViolation.class);
            verify(violationPolicy).onViolation(captor.capture(), eq(2));
            assertEquals("slow", captor.getValue().action());

            tracker.reset("a");
            assertEquals(0, tracker.count("a"));
        }

        @Test
        @DisplayName("输出按序列化字节累计")
        void outputMeter() {
            OutputMeter meter = new OutputMeter("a", "dump", 10);
            meter.add("abc");
            assertEquals(5, meter.total());
            ResourceLimitExceededException e = assertThrows(ResourceLimitExceededException.class,
                    () -> meter.add("abcdefgh"));
            assertEquals(LimitType.OUTPUT_SIZE, e.getLimitType());
        }
    }
}
