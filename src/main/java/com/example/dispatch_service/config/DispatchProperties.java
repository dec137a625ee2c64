package com.example.dispatch_service.config;

import com.example.dispatch_service.entity.UserRole;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

@Getter
@Setter
@ConfigurationProperties(prefix = "dispatch")
public class DispatchProperties {

    private String[] endpoints = {"/ws/trip", "/ws/trip/"};
    private String[] allowedOrigins = {"*"};
    private String driverPoolGroup = "drivers";

    private final Auth auth = new Auth();
    private final Admission admission = new Admission();
    private final Trips trips = new Trips();
    private final Groups groups = new Groups();
    private final Outbound outbound = new Outbound();
    private final Storage storage = new Storage();

    @Getter
    @Setter
    public static class Auth {
        private String tokenParameter = "token";
        private String tokenKeyPrefix = "token:";
    }

    @Getter
    @Setter
    public static class Admission {
        // true 이면 토큰 없는 연결도 유지 (조회 전용 뷰어)
        private boolean allowAnonymous = false;
        private Set<UserRole> allowedRoles = EnumSet.allOf(UserRole.class);
    }

    @Getter
    @Setter
    public static class Trips {
        private boolean strictTransitions = false;
        private boolean enforceParticipation = true;
    }

    @Getter
    @Setter
    public static class Groups {
        private String backend = "memory";
        private String channelPrefix = "dispatch:group:";
    }

    @Getter
    @Setter
    public static class Outbound {
        private Duration sendTimeLimit = Duration.ofSeconds(10);
        private int bufferSizeLimit = 512 * 1024;
    }

    @Getter
    @Setter
    public static class Storage {
        // 트랜잭션 하나의 제한 시간. 넘기면 롤백된다
        private Duration timeout = Duration.ofSeconds(3);
        // 서킷 브레이커 타임리미터 = timeout + margin. 롤백이 끝나기 전에 호출자를 놓아주지 않도록 함
        private Duration timeLimiterMargin = Duration.ofSeconds(2);
    }
}
