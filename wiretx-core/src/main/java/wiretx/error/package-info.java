/**
 * Classification of server errors into errors that stay local to a call and errors after
 * which the connection is dropped.
 */
package wiretx.error;
