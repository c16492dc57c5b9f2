package com.questrail.beatbag.audio;

/**
 * Port to the audio layer that plays the currently selected kick sound.
 *
 * <p>Playback, mixing and the sound library live outside this library.</p>
 */
@FunctionalInterface
public interface KickSoundTrigger
{
    /**
     * Play the current sound.
     *
     * @param volume playback volume in {@code [0.0, 1.0]}
     */
    void play(float volume);
}
