/**
 * Instruction Interpreter: 요청 원문을 검증된 정규 연산 체인으로 변환.
 *
 * <ul>
 *   <li>{@link com.ryuqq.audioedit.application.interpreter.InstructionInterpreter} - 검증 진입점</li>
 *   <li>{@link com.ryuqq.audioedit.application.interpreter.ChainCanonicalizer} - 우선순위 정렬</li>
 *   <li>{@link com.ryuqq.audioedit.application.interpreter.OperationGuesser} - 자유 텍스트 추정 포트</li>
 * </ul>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
package com.ryuqq.audioedit.application.interpreter;
