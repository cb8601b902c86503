/**
 * Declaration tag grammar: {@code NAME | NAME,default | NAME,required}.
 *
 * @since 1.0.0
 */
package com.envbind.core.tag;
