package com.dubbi.screentrail.explore.classify;

import com.dubbi.screentrail.explore.snapshot.ScreenSnapshot;
import java.util.List;
import java.util.Set;

/**
 * 시스템 권한 요청 화면 감지 (전경 앱 식별자가 설정된 권한 패키지와 같을 때)
 */
public class PermissionPromptDetector {
    public static final List<String> DEFAULT_PACKAGES = List.of(
            "com.android.permissioncontroller",
            "com.google.android.permissioncontroller",
            "com.android.packageinstaller",
            "com.google.android.packageinstaller"
    );

    private final Set<String> packages;

    public PermissionPromptDetector(List<String> packages) {
        this.packages = Set.copyOf(packages == null ? DEFAULT_PACKAGES : packages);
    }

    public boolean isPermissionPrompt(ScreenSnapshot snapshot) {
        return snapshot != null
                && snapshot.foregroundAppId() != null
                && packages.contains(snapshot.foregroundAppId());
    }
}
