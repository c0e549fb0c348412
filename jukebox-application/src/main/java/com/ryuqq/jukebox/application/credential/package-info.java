/**
 * 자격 증명 선택 / 교체 계약.
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
package com.ryuqq.jukebox.application.credential;
