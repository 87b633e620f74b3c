package com.ryuqq.retention.core.model;

/**
 * 리컨실 대상 리소스의 식별자 (namespace + name).
 *
 * <p>ResourceKey는 리컨실 요청(ReconciliationRequest) 자체이기도 합니다.
 * 영속화되지 않으며, 이벤트 분류기가 생성하고 리컨실러가 소비합니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>namespace, name 모두 null 또는 빈 문자열 불가</li>
 *   <li>name 길이: 1~253자</li>
 * </ul>
 *
 * @param namespace 리소스 네임스페이스
 * @param name 리소스 이름
 *
 * @author Retention Team
 * @since 1.0.0
 */
public record ResourceKey(
    String namespace,
    String name
) {

    private static final int MAX_NAME_LENGTH = 253;

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException namespace 또는 name이 유효하지 않은 경우
     */
    public ResourceKey {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw new IllegalArgumentException("name length cannot exceed " + MAX_NAME_LENGTH + " characters");
        }
    }

    /**
     * 키 이름으로 사용할 수 있는지 확인.
     *
     * @param name 검사할 이름
     * @return 비어 있지 않고 최대 길이 이하이면 true
     */
    public static boolean isValidName(String name) {
        return name != null && !name.isBlank() && name.length() <= MAX_NAME_LENGTH;
    }

    /**
     * ResourceKey 생성.
     *
     * @param namespace 네임스페이스
     * @param name 이름
     * @return ResourceKey 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ResourceKey of(String namespace, String name) {
        return new ResourceKey(namespace, name);
    }

    @Override
    public String toString() {
        return namespace + "/" + name;
    }
}
