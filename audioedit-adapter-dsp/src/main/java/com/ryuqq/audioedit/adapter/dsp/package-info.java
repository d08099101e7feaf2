/**
 * 인메모리 PCM 버퍼 위에서 동작하는 연산 실행기.
 *
 * <p>{@link com.ryuqq.audioedit.adapter.dsp.PcmCatalogs#standard()}가 표준 연산 전부를
 * 등록한 카탈로그를 만듭니다.</p>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
package com.ryuqq.audioedit.adapter.dsp;
